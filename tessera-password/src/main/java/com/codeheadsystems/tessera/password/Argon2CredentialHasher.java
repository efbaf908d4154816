package com.codeheadsystems.tessera.password;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialHasher} using Argon2id from Bouncy Castle.
 * <p>
 * Records use the PHC string format:
 * <pre>{@code
 *   $argon2id$v=19$m=65536,t=3,p=1$<salt>$<hash>
 * }</pre>
 * with standard base64 without padding for salt and hash. Records made with other parameters, or
 * with argon2i/argon2d, still verify; {@link #needsRehash} reports them.
 */
public class Argon2CredentialHasher implements CredentialHasher {

  private static final Logger log = LoggerFactory.getLogger(Argon2CredentialHasher.class);

  public static final int SALT_BYTES = 16;
  public static final int HASH_BYTES = 32;

  private static final String ARGON2ID = "argon2id";
  private static final int VERSION = Argon2Parameters.ARGON2_VERSION_13;
  // Upper bounds on costs read from a record; anything above is a corrupt or hostile record.
  private static final long MAX_MEMORY_KIB = 4L * 1024 * 1024;
  private static final int MAX_ITERATIONS = 1024;
  private static final int MAX_PARALLELISM = 255;

  private static final Base64.Encoder ENCODER = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getDecoder();

  private final HashParameters parameters;
  private final SecureRandom random;

  /**
   * Instantiates a new Argon2 credential hasher with {@link HashParameters#DEFAULT}.
   */
  public Argon2CredentialHasher() {
    this(HashParameters.DEFAULT);
  }

  public Argon2CredentialHasher(HashParameters parameters) {
    this(parameters, new SecureRandom());
  }

  /**
   * Instantiates a new Argon2 credential hasher.
   *
   * @param parameters cost parameters for new hashes
   * @param random     salt source
   */
  public Argon2CredentialHasher(HashParameters parameters, SecureRandom random) {
    this.parameters = parameters;
    this.random = random;
  }

  public HashParameters parameters() {
    return parameters;
  }

  @Override
  public String hash(String password) {
    byte[] salt = new byte[SALT_BYTES];
    random.nextBytes(salt);
    byte[] digest = derive(Argon2Parameters.ARGON2_id, VERSION, parameters, salt, password, HASH_BYTES);
    return "$" + ARGON2ID
        + "$v=" + VERSION
        + "$m=" + parameters.memoryKib() + ",t=" + parameters.iterations() + ",p=" + parameters.parallelism()
        + "$" + ENCODER.encodeToString(salt)
        + "$" + ENCODER.encodeToString(digest);
  }

  @Override
  public boolean verify(String password, String record) {
    HashRecord parsed = HashRecord.parse(record);
    byte[] candidate = derive(parsed.type(), parsed.version(), parsed.parameters(), parsed.salt(),
        password, parsed.hash().length);
    boolean matches = MessageDigest.isEqual(candidate, parsed.hash());
    if (!matches) {
      log.debug("Password verification failed");
    }
    return matches;
  }

  @Override
  public boolean needsRehash(String record) {
    HashRecord parsed = HashRecord.parse(record);
    return parsed.type() != Argon2Parameters.ARGON2_id
        || parsed.version() != VERSION
        || parsed.hash().length < HASH_BYTES
        || parsed.parameters().isWeakerThan(parameters);
  }

  private static byte[] derive(int type, int version, HashParameters params, byte[] salt,
                               String password, int length) {
    Argon2Parameters argon2 = new Argon2Parameters.Builder(type)
        .withVersion(version)
        .withSalt(salt)
        .withMemoryAsKB(params.memoryKib())
        .withIterations(params.iterations())
        .withParallelism(params.parallelism())
        .build();
    Argon2BytesGenerator generator = new Argon2BytesGenerator();
    generator.init(argon2);
    byte[] output = new byte[length];
    generator.generateBytes(password.getBytes(StandardCharsets.UTF_8), output, 0, output.length);
    return output;
  }

  /**
   * A parsed PHC record.
   */
  record HashRecord(int type, int version, HashParameters parameters, byte[] salt, byte[] hash) {

    static HashRecord parse(String record) {
      if (record == null) {
        throw new InvalidHashRecordException("Hash record is missing");
      }
      String[] parts = record.split("\\$", -1);
      if (parts.length != 6 || !parts[0].isEmpty()) {
        throw new InvalidHashRecordException("Hash record is not a PHC string");
      }
      int type = type(parts[1]);
      int version = version(parts[2]);
      HashParameters parameters = parameters(parts[3]);
      byte[] salt = decode(parts[4], "salt");
      byte[] hash = decode(parts[5], "hash");
      if (salt.length < 8) {
        throw new InvalidHashRecordException("Hash record salt is too short");
      }
      if (hash.length < 4) {
        throw new InvalidHashRecordException("Hash record digest is too short");
      }
      return new HashRecord(type, version, parameters, salt, hash);
    }

    private static int type(String algorithm) {
      switch (algorithm) {
        case "argon2id":
          return Argon2Parameters.ARGON2_id;
        case "argon2i":
          return Argon2Parameters.ARGON2_i;
        case "argon2d":
          return Argon2Parameters.ARGON2_d;
        default:
          throw new InvalidHashRecordException("Unsupported algorithm: " + algorithm);
      }
    }

    private static int version(String field) {
      if (!field.startsWith("v=")) {
        throw new InvalidHashRecordException("Hash record has no version field");
      }
      int version = number(field.substring(2), "version");
      if (version != Argon2Parameters.ARGON2_VERSION_13 && version != Argon2Parameters.ARGON2_VERSION_10) {
        throw new InvalidHashRecordException("Unsupported Argon2 version: " + version);
      }
      return version;
    }

    private static HashParameters parameters(String field) {
      String[] pairs = field.split(",", -1);
      if (pairs.length != 3 || !pairs[0].startsWith("m=") || !pairs[1].startsWith("t=")
          || !pairs[2].startsWith("p=")) {
        throw new InvalidHashRecordException("Hash record parameters must be m=,t=,p=");
      }
      int memory = number(pairs[0].substring(2), "memory");
      int iterations = number(pairs[1].substring(2), "iterations");
      int parallelism = number(pairs[2].substring(2), "parallelism");
      if (memory > MAX_MEMORY_KIB) {
        throw new InvalidHashRecordException("Hash record memory cost is out of range");
      }
      if (iterations > MAX_ITERATIONS) {
        throw new InvalidHashRecordException("Hash record iteration count is out of range");
      }
      if (parallelism > MAX_PARALLELISM) {
        throw new InvalidHashRecordException("Hash record parallelism is out of range");
      }
      try {
        return new HashParameters(memory, iterations, parallelism);
      } catch (IllegalArgumentException e) {
        throw new InvalidHashRecordException("Hash record parameters are invalid: " + e.getMessage(), e);
      }
    }

    private static int number(String value, String name) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        throw new InvalidHashRecordException("Hash record " + name + " is not a number", e);
      }
    }

    private static byte[] decode(String value, String name) {
      try {
        return DECODER.decode(value);
      } catch (IllegalArgumentException e) {
        throw new InvalidHashRecordException("Hash record " + name + " is not base64", e);
      }
    }
  }
}
