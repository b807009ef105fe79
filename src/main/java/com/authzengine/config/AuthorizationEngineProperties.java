package com.authzengine.config;

import com.authzengine.authorization.EvaluationMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the authorization engine.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "authz-engine.engine")
public class AuthorizationEngineProperties {

    @NotNull
    private EvaluationMode evaluationMode = EvaluationMode.SEQUENTIAL;

    /**
     * Threads available for evaluating rules concurrently.
     */
    @Min(1)
    private int parallelism = 4;

    @NotBlank
    private String threadNamePrefix = "authz-rule-";
}
