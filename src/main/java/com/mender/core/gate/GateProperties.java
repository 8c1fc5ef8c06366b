package com.mender.core.gate;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "mender.gate")
public class GateProperties {

    /** Minimum aggregate confidence (inclusive) for unattended application. */
    private int autoApplyThreshold = 95;

    /** Minimum confidence (inclusive) every single finding must reach. */
    private int highConfidenceThreshold = 85;

    public int getAutoApplyThreshold() { return autoApplyThreshold; }
    public void setAutoApplyThreshold(int autoApplyThreshold) { this.autoApplyThreshold = autoApplyThreshold; }
    public int getHighConfidenceThreshold() { return highConfidenceThreshold; }
    public void setHighConfidenceThreshold(int highConfidenceThreshold) { this.highConfidenceThreshold = highConfidenceThreshold; }
}
