package com.example.auth.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.security.oauth2.jose.jws.SignatureAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties({OidcProviderProperties.class, AuthProperties.class})
public class IdentityProviderClientConfig {

  @Bean
  RestClient idpRestClient(RestClient.Builder builder, OidcProviderProperties properties) {
    // token endpoint 呼び出し専用 RestClient。タイムアウトは設定値で上限を切る。
    return builder.requestFactory(requestFactory(properties)).build();
  }

  @Bean
  JwtDecoder idTokenDecoder(OidcProviderProperties properties, Clock clock) {
    // JWK Set は初回検証時に取得されるため、起動時に IdP へは接続しない。
    // 取得も token endpoint と同じタイムアウトで打ち切る。
    final NimbusJwtDecoder decoder =
        NimbusJwtDecoder.withJwkSetUri(properties.jwkSetUri())
            .jwsAlgorithm(SignatureAlgorithm.RS256)
            .restOperations(new RestTemplate(requestFactory(properties)))
            .build();
    decoder.setJwtValidator(IdTokenValidators.create(properties, clock));
    return decoder;
  }

  private static SimpleClientHttpRequestFactory requestFactory(OidcProviderProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return requestFactory;
  }
}
