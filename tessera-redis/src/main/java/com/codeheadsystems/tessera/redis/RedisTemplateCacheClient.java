package com.codeheadsystems.tessera.redis;

import com.codeheadsystems.tessera.exceptions.BackendUnavailableException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStringCommands.SetOption;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.types.Expiration;
import org.springframework.data.redis.serializer.RedisSerializer;

/**
 * {@link CacheClient} over Spring Data Redis.
 * <p>
 * Commands used: {@code SET NX PX}, {@code SET XX KEEPTTL}, {@code GET}, {@code GETEX PX},
 * {@code PTTL}, {@code PEXPIRE} and {@code DEL}. {@code GETEX} needs Redis 6.2 or later, {@code KEEPTTL} 6.0.
 */
public class RedisTemplateCacheClient implements CacheClient {

  private final RedisTemplate<String, byte[]> template;

  /**
   * Instantiates a new Redis template cache client.
   *
   * @param template a template with string keys and raw byte values, see {@link #templateFor}
   */
  public RedisTemplateCacheClient(RedisTemplate<String, byte[]> template) {
    this.template = template;
  }

  /**
   * Builds a template with string keys and unconverted byte array values.
   *
   * @param connectionFactory the connection factory
   * @return the initialized template
   */
  public static RedisTemplate<String, byte[]> templateFor(RedisConnectionFactory connectionFactory) {
    RedisTemplate<String, byte[]> template = new RedisTemplate<>();
    template.setConnectionFactory(connectionFactory);
    template.setKeySerializer(RedisSerializer.string());
    template.setValueSerializer(RedisSerializer.byteArray());
    template.afterPropertiesSet();
    return template;
  }

  @Override
  public boolean setIfAbsent(String key, byte[] value, Duration ttl) {
    return call(() -> Boolean.TRUE.equals(template.opsForValue().setIfAbsent(key, value, ttl)));
  }

  @Override
  public boolean setIfPresent(String key, byte[] value) {
    byte[] rawKey = key.getBytes(StandardCharsets.UTF_8);
    return call(() -> Boolean.TRUE.equals(template.execute((RedisCallback<Boolean>) connection ->
        connection.stringCommands().set(rawKey, value, Expiration.keepTtl(), SetOption.ifPresent()))));
  }

  @Override
  public Optional<byte[]> get(String key) {
    return call(() -> Optional.ofNullable(template.opsForValue().get(key)));
  }

  @Override
  public Optional<byte[]> getAndExpire(String key, Duration ttl) {
    return call(() -> Optional.ofNullable(template.opsForValue().getAndExpire(key, ttl)));
  }

  @Override
  public Optional<Duration> remainingTtl(String key) {
    Long millis = call(() -> template.getExpire(key, TimeUnit.MILLISECONDS));
    // -2: no such key, -1: no expiry
    if (millis == null || millis < 0) {
      return Optional.empty();
    }
    return Optional.of(Duration.ofMillis(millis));
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    return call(() -> Boolean.TRUE.equals(template.expire(key, ttl)));
  }

  @Override
  public void delete(String key) {
    call(() -> template.delete(key));
  }

  private static <T> T call(Supplier<T> command) {
    try {
      return command.get();
    } catch (DataAccessException e) {
      throw new BackendUnavailableException("Redis command failed: " + e.getMessage(), e);
    }
  }
}
