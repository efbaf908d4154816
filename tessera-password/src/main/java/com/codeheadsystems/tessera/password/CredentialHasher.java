package com.codeheadsystems.tessera.password;

/**
 * Hashes and verifies passwords as self-describing records.
 */
public interface CredentialHasher {

  /**
   * Hashes a password with a fresh salt under the current parameters.
   *
   * @param password the password
   * @return the record, carrying algorithm, parameters, salt and digest
   */
  String hash(String password);

  /**
   * Checks a password against a record, in time independent of where the digests differ.
   *
   * @param password the candidate password
   * @param record   a record produced by {@link #hash}, possibly under older parameters
   * @return true if the password matches
   * @throws InvalidHashRecordException if the record cannot be parsed
   */
  boolean verify(String password, String record);

  /**
   * Whether a record was produced under parameters weaker than the current ones.
   *
   * @param record the record
   * @return true if the password should be re-hashed at the next successful login
   * @throws InvalidHashRecordException if the record cannot be parsed
   */
  boolean needsRehash(String record);
}
