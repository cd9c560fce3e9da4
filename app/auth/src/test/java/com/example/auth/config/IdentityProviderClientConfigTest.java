package com.example.auth.config;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import com.example.auth.model.RejectReason;
import com.example.auth.service.LoginRejectedException;
import com.example.auth.service.OidcTokenVerifier;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jose.jws.SignatureAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

class IdentityProviderClientConfigTest {

  private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
  private static final String CLIENT_ID = "client-1";
  private static final Duration BOUND = Duration.ofSeconds(10);

  private final Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
  private final List<Socket> accepted = new ArrayList<>();
  private ServerSocket stalledServer;
  private Thread acceptor;

  @BeforeEach
  void startStalledServer() throws IOException {
    // 接続は受け付けるが応答を一切返さない JWK エンドポイント
    stalledServer = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    acceptor =
        new Thread(
            () -> {
              while (!stalledServer.isClosed()) {
                try {
                  final Socket socket = stalledServer.accept();
                  synchronized (accepted) {
                    accepted.add(socket);
                  }
                } catch (IOException ex) {
                  return;
                }
              }
            },
            "stalled-jwk-endpoint");
    acceptor.setDaemon(true);
    acceptor.start();
  }

  @AfterEach
  void stopStalledServer() throws IOException, InterruptedException {
    stalledServer.close();
    synchronized (accepted) {
      for (Socket socket : accepted) {
        socket.close();
      }
    }
    acceptor.join(1000);
  }

  @Test
  void idTokenDecoderGivesUpOnStalledJwkEndpoint() {
    final JwtDecoder decoder =
        new IdentityProviderClientConfig().idTokenDecoder(propertiesWithStalledJwkSet(), clock);
    final String idToken = signedIdToken();

    assertTimeoutPreemptively(
        BOUND,
        () -> assertThatThrownBy(() -> decoder.decode(idToken)).isInstanceOf(JwtException.class));
  }

  @Test
  void stalledJwkEndpointRejectsLoginAsExchangeFailed() {
    final OidcTokenVerifier verifier =
        new OidcTokenVerifier(
            new IdentityProviderClientConfig()
                .idTokenDecoder(propertiesWithStalledJwkSet(), clock));
    final String idToken = signedIdToken();

    assertTimeoutPreemptively(
        BOUND,
        () ->
            assertThatThrownBy(() -> verifier.verify(idToken))
                .isInstanceOf(LoginRejectedException.class)
                .extracting(ex -> ((LoginRejectedException) ex).reason())
                .isEqualTo(RejectReason.EXCHANGE_FAILED));
  }

  private OidcProviderProperties propertiesWithStalledJwkSet() {
    return new OidcProviderProperties(
        CLIENT_ID,
        "secret-1",
        "http://localhost:5001/auth/callback",
        null,
        null,
        "http://127.0.0.1:" + stalledServer.getLocalPort() + "/certs",
        null,
        null,
        null,
        Duration.ofSeconds(1),
        Duration.ofSeconds(1));
  }

  private static String signedIdToken() {
    final KeyPair keyPair = generateRsaKeyPair();
    final RSAKey jwk =
        new RSAKey.Builder((RSAPublicKey) keyPair.getPublic())
            .privateKey((RSAPrivateKey) keyPair.getPrivate())
            .keyID("idp-key")
            .build();
    final NimbusJwtEncoder encoder = new NimbusJwtEncoder(new ImmutableJWKSet<>(new JWKSet(jwk)));
    final JwtClaimsSet claims =
        JwtClaimsSet.builder()
            .issuer("https://accounts.google.com")
            .subject("google-sub-1")
            .audience(List.of(CLIENT_ID))
            .issuedAt(T0)
            .expiresAt(T0.plus(Duration.ofHours(1)))
            .claim("email", "someone@example.com")
            .build();
    final JwsHeader header = JwsHeader.with(SignatureAlgorithm.RS256).keyId("idp-key").build();
    return encoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
  }

  private static KeyPair generateRsaKeyPair() {
    try {
      final KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(2048);
      return generator.generateKeyPair();
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException(ex);
    }
  }
}
