package com.example.auth.service;

import com.example.auth.model.LoginStage;
import com.example.auth.model.OidcClaims;
import com.example.auth.model.RejectReason;
import com.example.common.security.Identity;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * IdP からの callback を処理し、検証済み Identity を返す。
 *
 * <p>処理順は code 有無 → state 消費 → code 交換 → id_token 検証 → ロール解決。code が無い場合は state
 * を消費せず、外部呼び出しもしない。想定外の例外は INTERNAL_ERROR に畳み込む。
 */
@Service
@RequiredArgsConstructor
public class OidcCallbackService {

  private static final Logger logger = LoggerFactory.getLogger(OidcCallbackService.class);

  private final LoginStateService loginStateService;
  private final OidcTokenClient tokenClient;
  private final OidcTokenVerifier tokenVerifier;
  private final RoleResolver roleResolver;

  public Identity complete(String state, String code) {
    LoginStage stage = LoginStage.CALLBACK_RECEIVED;
    try {
      if (code == null || code.isBlank()) {
        throw new LoginRejectedException(RejectReason.MISSING_CODE, "authorization code is missing");
      }
      if (!loginStateService.consume(state)) {
        throw new LoginRejectedException(RejectReason.STATE_MISMATCH, "state is not valid");
      }
      stage = LoginStage.STATE_VALIDATED;

      final String idToken = tokenClient.exchangeCode(code);
      stage = LoginStage.CODE_EXCHANGED;

      final OidcClaims claims = tokenVerifier.verify(idToken);
      stage = LoginStage.IDENTITY_VERIFIED;

      final String role = roleResolver.resolve(claims.email());
      logger.info("login identity verified subject={} role={}", claims.subject(), role);
      return new Identity(claims.subject(), claims.email(), claims.name(), claims.picture(), role);
    } catch (LoginRejectedException ex) {
      logger.info("login rejected at stage={} reason={}", stage, ex.reason());
      throw ex;
    } catch (RuntimeException ex) {
      logger.error("login failed unexpectedly at stage={}", stage, ex);
      throw new LoginRejectedException(RejectReason.INTERNAL_ERROR, "internal error", ex);
    }
  }
}
