package com.adinsight.segment.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI segmentAnalysisOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Anomaly Segment Analysis API")
                        .version("1.0.0")
                        .description(
                                "Turns already-detected campaign performance anomalies into ranked, explainable intelligence.\n\n" +
                                "**Analyses:**\n" +
                                "- `POST /segments/analyze`: ranked campaign segments, insights, metric correlations, propagation path\n" +
                                "- `POST /segments/campaigns/compare`: per-campaign health score (0-100), most at-risk first\n" +
                                "- `POST /segments/time-patterns`: weekday / weekend / periodic / consistent classification\n" +
                                "- `POST /segments/kpi-time-patterns`: day-of-week KPI baselines and deviating days\n" +
                                "- `POST /segments/metric-categories`: spend / engagement / conversion breakdown\n\n" +
                                "**Severity weights:** critical=3, warning=2, info=1\n\n" +
                                "All analyses are stateless: nothing is read from or written to storage.")
                        .contact(new Contact().name("Ad Insight Analytics Team")));
    }
}
