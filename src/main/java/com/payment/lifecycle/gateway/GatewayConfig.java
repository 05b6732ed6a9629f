package com.payment.lifecycle.gateway;

import com.payment.lifecycle.config.GatewayProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for outbound gateway calls. Both timeouts are bounded so a hung gateway
 * degrades to {@link com.payment.lifecycle.api.GatewayUnavailableException}.
 */
@Configuration
public class GatewayConfig {

    @Bean
    public RestTemplate gatewayRestTemplate(GatewayProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return new RestTemplate(factory);
    }
}
