package org.nowstart.spxsignal.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "spxsignal.report")
public record ReportProperties(
        // annual risk-free rate subtracted in the Sharpe ratio
        @DecimalMin("0") @DefaultValue("0.0") double riskFreeRate,
        // capital-series periods per year used to annualize the Sharpe ratio
        @Positive @DefaultValue("252") int periodsPerYear
) {

    public static final ReportProperties DEFAULTS = new ReportProperties(0.0, 252);
}
