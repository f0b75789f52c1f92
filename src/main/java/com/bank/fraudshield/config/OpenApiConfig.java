package com.bank.fraudshield.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fraudShieldOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Fraud Shield Engine API")
                        .version("1.0.0")
                        .description(
                                "Hybrid ML/DL ensemble fraud scoring with explanations.\n\n" +
                                "**Inference Pipeline:**\n" +
                                "1. Receive a feature map via `POST /predict`\n" +
                                "2. Validate it against the bundle's feature schema\n" +
                                "3. Scale it per model (none, standard, min-max)\n" +
                                "4. Score it with every base model in parallel (quorum required)\n" +
                                "5. Fuse base scores with the logistic meta-learner and calibrate\n" +
                                "6. Classify: **SAFE** (<0.30), **SUSPICIOUS** (0.30-0.70), **FRAUD** (>=0.70)\n\n" +
                                "**Model Families:**\n" +
                                "- `ML`: logistic regression and tree ensembles (random forest, gradient boosting)\n" +
                                "- `DL`: feed-forward, convolutional, recurrent and autoencoder networks\n\n" +
                                "`POST /explain` adds per-model attributions, risk factors and reviewer recommendations.")
                        .contact(new Contact().name("Fraud Shield Team")));
    }
}
