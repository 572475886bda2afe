package uk.gegc.docgen.features.upstream.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import uk.gegc.docgen.shared.http.RetryableHttpTransport;

import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties(OpenRouterProperties.class)
public class OpenRouterConfig {

    @Bean
    public ClientHttpRequestFactory upstreamRequestFactory(OpenRouterProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(properties.getReadTimeout());
        return factory;
    }

    @Bean
    public RetryableHttpTransport upstreamTransport(ClientHttpRequestFactory upstreamRequestFactory) {
        return new RetryableHttpTransport(upstreamRequestFactory);
    }
}
