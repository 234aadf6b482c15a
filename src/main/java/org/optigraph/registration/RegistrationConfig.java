package org.optigraph.registration;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration of {@link EdgeConstraintRegistrar}, bound once per root graph and inherited by
 * every sub-graph.
 */
@Value
@Builder
public class RegistrationConfig {

    /**
     * Multi-backend failure policy.
     */
    @Builder.Default
    RegistrationPolicy policy = RegistrationPolicy.VALIDATE_THEN_COMMIT;

    /**
     * Returns config with {@link RegistrationPolicy#VALIDATE_THEN_COMMIT}.
     */
    public static RegistrationConfig validateThenCommit() {
        return RegistrationConfig.builder()
                .policy(RegistrationPolicy.VALIDATE_THEN_COMMIT)
                .build();
    }

    /**
     * Returns config with {@link RegistrationPolicy#BEST_EFFORT}.
     */
    public static RegistrationConfig bestEffort() {
        return RegistrationConfig.builder()
                .policy(RegistrationPolicy.BEST_EFFORT)
                .build();
    }

    /**
     * Returns default registration config.
     */
    public static RegistrationConfig defaultConfig() {
        return validateThenCommit();
    }
}
