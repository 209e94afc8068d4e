package com.codeheadsystems.pds.server.auth;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.HexFormat;
import org.bouncycastle.crypto.generators.SCrypt;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * scrypt password hashing. Stored values are {@code saltHex:hashHex}.
 */
public class ScryptPasswordHasher implements PasswordHasher {

  /**
   * Default CPU/memory cost.
   */
  public static final int DEFAULT_COST = 16384;

  private static final Logger log = LoggerFactory.getLogger(ScryptPasswordHasher.class);
  private static final HexFormat HEX = HexFormat.of();
  private static final int BLOCK_SIZE = 8;
  private static final int PARALLELIZATION = 1;
  private static final int KEY_LENGTH = 64;
  private static final int SALT_LENGTH = 16;

  private final SecureRandom random;
  private final int cost;

  /**
   * Instantiates a new Scrypt password hasher with the default cost.
   */
  public ScryptPasswordHasher() {
    this(new SecureRandom(), DEFAULT_COST);
  }

  /**
   * Instantiates a new Scrypt password hasher.
   *
   * @param random salt source
   * @param cost   CPU/memory cost, a power of two
   */
  public ScryptPasswordHasher(SecureRandom random, int cost) {
    if (cost < 2 || Integer.bitCount(cost) != 1) {
      throw new IllegalArgumentException("scrypt cost must be a power of two greater than 1: " + cost);
    }
    this.random = random;
    this.cost = cost;
  }

  @Override
  public String hash(String password) {
    byte[] salt = new byte[SALT_LENGTH];
    random.nextBytes(salt);
    return HEX.formatHex(salt) + ":" + HEX.formatHex(derive(password, salt));
  }

  @Override
  public boolean verify(String password, String stored) {
    int colon = stored.indexOf(':');
    if (colon < 0) {
      log.debug("Stored password hash is not in salt:hash form");
      return false;
    }
    byte[] salt = HEX.parseHex(stored, 0, colon);
    byte[] expected = HEX.parseHex(stored, colon + 1, stored.length());
    return Arrays.constantTimeAreEqual(expected, derive(password, salt));
  }

  private byte[] derive(String password, byte[] salt) {
    return SCrypt.generate(password.getBytes(StandardCharsets.UTF_8), salt, cost, BLOCK_SIZE,
        PARALLELIZATION, KEY_LENGTH);
  }
}
