package it.unimib.datai.handlerharness.cli.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One handler target with its loop defaults. Unset fields fall back to the built-in defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Context {
    private String endpoint;
    private String functionName;
    private Integer maxReinvoke;
    private Integer enforceTimeoutSeconds;

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getFunctionName() {
        return functionName;
    }

    public void setFunctionName(String functionName) {
        this.functionName = functionName;
    }

    public Integer getMaxReinvoke() {
        return maxReinvoke;
    }

    public void setMaxReinvoke(Integer maxReinvoke) {
        this.maxReinvoke = maxReinvoke;
    }

    public Integer getEnforceTimeoutSeconds() {
        return enforceTimeoutSeconds;
    }

    public void setEnforceTimeoutSeconds(Integer enforceTimeoutSeconds) {
        this.enforceTimeoutSeconds = enforceTimeoutSeconds;
    }
}
