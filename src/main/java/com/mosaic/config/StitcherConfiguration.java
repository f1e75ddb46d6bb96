package com.mosaic.config;

import com.mosaic.imageStitching.StitcherFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(StitcherProperties.class)
public class StitcherConfiguration {

    @Bean
    public StitcherFactory stitcherFactory(StitcherProperties properties) {
        return new StitcherFactory(properties.validate());
    }
}
