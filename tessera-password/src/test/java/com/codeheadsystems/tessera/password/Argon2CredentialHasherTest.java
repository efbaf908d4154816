package com.codeheadsystems.tessera.password;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class Argon2CredentialHasherTest {

  private static final HashParameters CHEAP = new HashParameters(1024, 1, 1);
  private static final String PHC = "^\\$argon2id\\$v=19\\$m=1024,t=1,p=1\\$[A-Za-z0-9+/]{22}\\$[A-Za-z0-9+/]{43}$";

  private final Argon2CredentialHasher hasher = new Argon2CredentialHasher(CHEAP);

  @Test
  void hash_producesPhcRecord() {
    assertThat(hasher.hash("correct horse")).matches(PHC);
  }

  @Test
  void hash_thenVerify() {
    String record = hasher.hash("correct horse");

    assertThat(hasher.verify("correct horse", record)).isTrue();
    assertThat(hasher.verify("correct horsf", record)).isFalse();
  }

  @Test
  void hash_usesFreshSalt() {
    assertThat(hasher.hash("same")).isNotEqualTo(hasher.hash("same"));
  }

  @Test
  void verify_recordFromOlderParameters() {
    String old = new Argon2CredentialHasher(new HashParameters(512, 1, 1)).hash("pw");

    assertThat(hasher.verify("pw", old)).isTrue();
    assertThat(hasher.needsRehash(old)).isTrue();
  }

  @Test
  void needsRehash_currentParameters_isFalse() {
    assertThat(hasher.needsRehash(hasher.hash("pw"))).isFalse();
  }

  @Test
  void needsRehash_strongerRecord_isFalse() {
    String stronger = new Argon2CredentialHasher(new HashParameters(2048, 2, 1)).hash("pw");

    assertThat(hasher.needsRehash(stronger)).isFalse();
  }

  @Test
  void argon2iRecord_verifiesButNeedsRehash() {
    byte[] salt = "0123456789abcdef".getBytes(StandardCharsets.US_ASCII);
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_i)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(1024)
        .withIterations(1)
        .withParallelism(1)
        .build();
    Argon2BytesGenerator generator = new Argon2BytesGenerator();
    generator.init(params);
    byte[] digest = new byte[32];
    generator.generateBytes("pw".getBytes(StandardCharsets.UTF_8), digest, 0, digest.length);
    Base64.Encoder encoder = Base64.getEncoder().withoutPadding();
    String record = "$argon2i$v=19$m=1024,t=1,p=1$" + encoder.encodeToString(salt) + "$"
        + encoder.encodeToString(digest);

    assertThat(hasher.verify("pw", record)).isTrue();
    assertThat(hasher.needsRehash(record)).isTrue();
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {
      "plaintext",
      "$argon2id$v=19$m=1024,t=1,p=1$c2FsdHNhbHQ",
      "$bcrypt$v=19$m=1024,t=1,p=1$c2FsdHNhbHRzYWx0$aGFzaGhhc2hoYXNoaGFzaA",
      "$argon2id$v=18$m=1024,t=1,p=1$c2FsdHNhbHRzYWx0$aGFzaGhhc2hoYXNoaGFzaA",
      "$argon2id$m=1024,t=1,p=1$c2FsdHNhbHRzYWx0$aGFzaGhhc2hoYXNoaGFzaA$x",
      "$argon2id$v=19$m=abc,t=1,p=1$c2FsdHNhbHRzYWx0$aGFzaGhhc2hoYXNoaGFzaA",
      "$argon2id$v=19$t=1,m=1024,p=1$c2FsdHNhbHRzYWx0$aGFzaGhhc2hoYXNoaGFzaA",
      "$argon2id$v=19$m=1024,t=0,p=1$c2FsdHNhbHRzYWx0$aGFzaGhhc2hoYXNoaGFzaA",
      "$argon2id$v=19$m=2147483647,t=1,p=1$c2FsdHNhbHRzYWx0$aGFzaGhhc2hoYXNoaGFzaA",
      "$argon2id$v=19$m=1024,t=2000000000,p=1$c2FsdHNhbHRzYWx0$aGFzaGhhc2hoYXNoaGFzaA",
      "$argon2id$v=19$m=1048576,t=1,p=100000$c2FsdHNhbHRzYWx0$aGFzaGhhc2hoYXNoaGFzaA",
      "$argon2id$v=19$m=1024,t=1,p=1$!!notbase64!!$aGFzaGhhc2hoYXNoaGFzaA",
      "$argon2id$v=19$m=1024,t=1,p=1$c2FsdA$aGFzaGhhc2hoYXNoaGFzaA"
  })
  void malformedRecord_throwsInsteadOfReturningFalse(String record) {
    assertThatThrownBy(() -> hasher.verify("pw", record)).isInstanceOf(InvalidHashRecordException.class);
    assertThatThrownBy(() -> hasher.needsRehash(record)).isInstanceOf(InvalidHashRecordException.class);
  }

  @Test
  void defaults_matchDocumentedCosts() {
    assertThat(new Argon2CredentialHasher().parameters()).isEqualTo(new HashParameters(65536, 3, 1));
  }

  @Test
  void hashParameters_rejectInvalidCosts() {
    assertThatThrownBy(() -> new HashParameters(1024, 0, 1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new HashParameters(1024, 1, 0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new HashParameters(8, 1, 2)).isInstanceOf(IllegalArgumentException.class);
  }
}
