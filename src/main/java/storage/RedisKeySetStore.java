package storage;

import config.SystemConfig;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Redis存储模块，缓存提供方的公钥集合 (JWK set JSON)
 */
public class RedisKeySetStore implements KeySetStore, AutoCloseable {
    private final JedisPool jedisPool;
    private final String key;

    public RedisKeySetStore(JedisPool jedisPool, String name) {
        this.jedisPool = Objects.requireNonNull(jedisPool);
        this.key = SystemConfig.KEY_SET_PREFIX + name;
    }

    /**
     * Opens a pool against the configured Redis server.
     */
    public static RedisKeySetStore connect(String name) {
        try {
            JedisPoolConfig config = new JedisPoolConfig();
            config.setMaxTotal(20);
            config.setMaxIdle(10);
            config.setMinIdle(1);
            config.setTestOnBorrow(false);
            config.setTestOnReturn(true);
            config.setTestWhileIdle(true);

            JedisPool pool = new JedisPool(config, SystemConfig.REDIS_HOST, SystemConfig.REDIS_PORT,
                    SystemConfig.REDIS_TIMEOUT_MS, null, SystemConfig.REDIS_DATABASE);
            System.out.println("✅ Redis连接池初始化成功");
            return new RedisKeySetStore(pool, name);
        } catch (Exception e) {
            System.err.println("❌ Redis连接失败: " + e.getMessage());
            throw new IllegalStateException("Failed to initialize Redis", e);
        }
    }

    /**
     * 从Redis检索公钥集合. A Redis failure is reported and treated as a miss.
     */
    @Override
    public byte[] load() {
        try (Jedis jedis = jedisPool.getResource()) {
            String value = jedis.get(key);
            return value == null ? null : value.getBytes(StandardCharsets.UTF_8);
        } catch (Exception e) {
            System.err.println("❌ 检索公钥集合失败: " + e.getMessage());
            return null;
        }
    }

    /**
     * 存储公钥集合到Redis
     */
    @Override
    public void save(byte[] document, long ttlSeconds) throws IOException {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.setex(key, ttlSeconds, new String(document, StandardCharsets.UTF_8));
            System.out.println("✅ 公钥集合已存储到Redis: " + key);
        } catch (Exception e) {
            System.err.println("❌ 存储公钥集合失败: " + e.getMessage());
            throw new IOException("Failed to store key set", e);
        }
    }

    public String getKey() {
        return key;
    }

    /**
     * 关闭Redis连接池
     */
    @Override
    public void close() {
        if (!jedisPool.isClosed()) {
            jedisPool.close();
            System.out.println("✅ Redis连接池已关闭");
        }
    }
}
