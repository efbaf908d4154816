package com.codeheadsystems.tessera.password;

/**
 * Argon2 cost parameters.
 *
 * @param memoryKib   memory in KiB
 * @param iterations  number of passes
 * @param parallelism lanes
 */
public record HashParameters(int memoryKib, int iterations, int parallelism) {

  /**
   * 64 MiB, 3 passes, 1 lane.
   */
  public static final HashParameters DEFAULT = new HashParameters(65536, 3, 1);

  /**
   * Instantiates a new Hash parameters.
   */
  public HashParameters {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be at least 1");
    }
    if (iterations < 1) {
      throw new IllegalArgumentException("iterations must be at least 1");
    }
    if (memoryKib < 8 * parallelism) {
      throw new IllegalArgumentException("memoryKib must be at least 8 * parallelism");
    }
  }

  /**
   * Whether any of these costs is below the corresponding cost of {@code other}.
   *
   * @param other the reference parameters
   * @return true if weaker in at least one dimension
   */
  public boolean isWeakerThan(HashParameters other) {
    return memoryKib < other.memoryKib
        || iterations < other.iterations
        || parallelism < other.parallelism;
  }
}
