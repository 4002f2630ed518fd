package com.montecarlo.riskengine.domain.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "volatility")
public class VolatilityProperties {

    private double garchOmega = 0.0001;
    private double garchAlpha = 0.10;
    private double garchBeta = 0.85;
    private boolean garchAutoFit = false;
}
