package com.gateflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Canonical, immutable description of one pipeline run.
 *
 * @param requestId          unique id generated once per run
 * @param domain             application domain the feature belongs to (e.g. "docsearch")
 * @param feature            feature under test (e.g. "user-group-management")
 * @param url                target page or endpoint
 * @param userStory          the user story the tests must cover
 * @param acceptanceCriteria ordered, non-empty list of acceptance criteria
 * @param dataRequirements   single or data-driven test data
 * @param constraints        execution constraints handed to the execution worker
 * @param authentication     how the workers authenticate against the target
 * @param testTarget         GUI page-object tests or API tests
 */
public record PipelineRequest(
    String requestId,
    String domain,
    String feature,
    String url,
    String userStory,
    List<String> acceptanceCriteria,
    DataRequirements dataRequirements,
    Constraints constraints,
    Authentication authentication,
    TestTarget testTarget
) implements Serializable {

    public PipelineRequest {
        acceptanceCriteria = acceptanceCriteria != null ? List.copyOf(acceptanceCriteria) : List.of();
        dataRequirements = dataRequirements != null ? dataRequirements : DataRequirements.single();
        constraints = constraints != null ? constraints : Constraints.defaults();
        authentication = authentication != null ? authentication : Authentication.none();
        testTarget = testTarget != null ? testTarget : TestTarget.GUI;
    }

    public PipelineRequest withRequestId(String id) {
        return new PipelineRequest(id, domain, feature, url, userStory, acceptanceCriteria,
                dataRequirements, constraints, authentication, testTarget);
    }

    /**
     * @param mode  SINGLE or DATA_DRIVEN
     * @param count number of data records wanted (1 for SINGLE)
     * @param seed  seed for reproducible data generation; nullable
     */
    public record DataRequirements(DataMode mode, int count, Long seed) implements Serializable {

        public DataRequirements {
            mode = mode != null ? mode : DataMode.SINGLE;
        }

        public static DataRequirements single() {
            return new DataRequirements(DataMode.SINGLE, 1, null);
        }

        public boolean dataDriven() {
            return mode == DataMode.DATA_DRIVEN;
        }
    }

    /**
     * @param timeoutSeconds per-test timeout handed to the executor
     * @param retries        per-test retries inside the executor (not pipeline retries)
     * @param browsers       browser projects to run on (chromium, firefox, webkit)
     */
    public record Constraints(int timeoutSeconds, int retries, List<String> browsers) implements Serializable {

        public Constraints {
            browsers = browsers != null && !browsers.isEmpty() ? List.copyOf(browsers) : List.of("chromium");
        }

        public static Constraints defaults() {
            return new Constraints(30, 0, List.of("chromium"));
        }
    }

    /**
     * @param type           authentication scheme
     * @param credentialsRef name of the credential set the workers resolve; never the secret itself
     */
    public record Authentication(AuthType type, String credentialsRef) implements Serializable {

        public Authentication {
            type = type != null ? type : AuthType.NONE;
        }

        public static Authentication none() {
            return new Authentication(AuthType.NONE, null);
        }
    }
}
