package org.authz.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.RegisteredClaims;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.JWTVerifier;
import com.auth0.jwt.interfaces.Verification;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.authz.exception.InvalidTokenException;

// A JWT (https://datatracker.ietf.org/doc/html/rfc7519) verifier for RS256 signed tokens.
public class JwtTokenVerifier implements TokenVerifier {

  static final String SCOPE_CLAIM = "scp";

  private static final Set<String> MAPPED_CLAIMS = Set.of(RegisteredClaims.SUBJECT,
      RegisteredClaims.ISSUER, RegisteredClaims.EXPIRES_AT, RegisteredClaims.JWT_ID, SCOPE_CLAIM);

  private final JWTVerifier verifier;

  // `pemFormatRSAPublicKey` is the RSA public key of the token issuer.
  // Example:
  // * To generate private key, run : `openssl genpkey -algorithm RSA -out private_key.pem -pkeyopt rsa_keygen_bits:2048`
  // * To generate public key, run: `openssl rsa -pubout -in private_key.pem -out public_key.pem`
  //
  // `expectedIssuer` is checked against `iss` unless it is null or blank.
  public JwtTokenVerifier(String pemFormatRSAPublicKey, String expectedIssuer,
      long leewaySeconds) throws GeneralSecurityException {
    RSAPublicKey publicKey = loadPublicKey(pemFormatRSAPublicKey);

    Verification verification = JWT.require(Algorithm.RSA256(publicKey, null))
        .acceptLeeway(leewaySeconds);
    if (expectedIssuer != null && !expectedIssuer.isBlank()) {
      verification = verification.withIssuer(expectedIssuer);
    }
    this.verifier = verification.build();
  }

  public JwtTokenVerifier(String pemFormatRSAPublicKey) throws GeneralSecurityException {
    this(pemFormatRSAPublicKey, null, 0);
  }

  @Override
  public Token verify(String token) throws InvalidTokenException {
    DecodedJWT jwt;
    try {
      jwt = verifier.verify(token);
    } catch (JWTVerificationException e) {
      throw new InvalidTokenException("Invalid JWT token: " + e.getMessage(), e);
    }

    String subject = jwt.getSubject();
    if (subject == null || subject.isBlank()) {
      throw new InvalidTokenException("JWT token has no subject.");
    }
    if (jwt.getExpiresAt() == null) {
      throw new InvalidTokenException("JWT token has no expiry.");
    }

    return Token.builder()
        .subject(subject)
        .issuer(jwt.getIssuer())
        .expiresAt(jwt.getExpiresAt().toInstant())
        .jwtId(jwt.getId())
        .scope(jwt.getClaim(SCOPE_CLAIM).asString())
        .claims(otherClaims(jwt))
        .build();
  }

  private static Map<String, Object> otherClaims(DecodedJWT jwt) {
    Map<String, Object> claims = new LinkedHashMap<>();
    for (Map.Entry<String, Claim> entry : jwt.getClaims().entrySet()) {
      if (MAPPED_CLAIMS.contains(entry.getKey()) || entry.getValue().isNull()) {
        continue;
      }
      claims.put(entry.getKey(), entry.getValue().as(Object.class));
    }
    return Collections.unmodifiableMap(claims);
  }

  private static RSAPublicKey loadPublicKey(String pemFormatRSAPublicKey)
      throws GeneralSecurityException {
    if (pemFormatRSAPublicKey == null || pemFormatRSAPublicKey.isBlank()) {
      throw new IllegalArgumentException("RSA public key must be provided");
    }
    String key = pemFormatRSAPublicKey
        .replace("-----BEGIN PUBLIC KEY-----", "")
        .replace("-----END PUBLIC KEY-----", "")
        .replaceAll("\\s", "");

    byte[] keyBytes = Base64.getDecoder().decode(key);

    X509EncodedKeySpec spec = new X509EncodedKeySpec(keyBytes);
    KeyFactory keyFactory = KeyFactory.getInstance("RSA");
    return (RSAPublicKey) keyFactory.generatePublic(spec);
  }
}
