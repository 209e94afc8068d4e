package com.codeheadsystems.pds.dropwizard;

import com.codeheadsystems.pds.dropwizard.auth.PdsAuthenticator;
import com.codeheadsystems.pds.dropwizard.auth.PdsPrincipal;
import com.codeheadsystems.pds.dropwizard.health.DatabaseHealthCheck;
import com.codeheadsystems.pds.identity.crypto.EcKeypair;
import com.codeheadsystems.pds.identity.crypto.KeyType;
import com.codeheadsystems.pds.identity.crypto.Keypair;
import com.codeheadsystems.pds.identity.did.AtprotoDidResolver;
import com.codeheadsystems.pds.identity.did.DidCache;
import com.codeheadsystems.pds.identity.did.DidResolver;
import com.codeheadsystems.pds.identity.did.PlcDidResolver;
import com.codeheadsystems.pds.identity.did.WebDidResolver;
import com.codeheadsystems.pds.identity.handle.ExternalHandleResolver;
import com.codeheadsystems.pds.identity.handle.WellKnownHandleResolver;
import com.codeheadsystems.pds.identity.plc.HttpPlcClient;
import com.codeheadsystems.pds.identity.plc.InMemoryPlcClient;
import com.codeheadsystems.pds.identity.plc.PlcClient;
import com.codeheadsystems.pds.server.ServiceConfig;
import com.codeheadsystems.pds.server.ServiceContext;
import com.codeheadsystems.pds.server.auth.ScryptPasswordHasher;
import com.codeheadsystems.pds.server.auth.TokenManager;
import com.codeheadsystems.pds.server.db.Database;
import com.codeheadsystems.pds.server.db.InMemoryDatabase;
import com.codeheadsystems.pds.server.db.jdbc.JdbcDatabase;
import com.codeheadsystems.pds.server.db.jdbc.SqlDialect;
import com.codeheadsystems.pds.server.manager.AccountRegistrationManager;
import com.codeheadsystems.pds.server.repo.RepoManager;
import com.codeheadsystems.pds.server.resource.ServerResource;
import com.codeheadsystems.pds.server.resource.XrpcExceptionMapper;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.http.HttpClient;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires PDS account provisioning into an existing Dropwizard application.
 * <p>
 * Registers the {@code com.atproto.server} XRPC resource, the XRPC error mapper, a database
 * health check and a bearer-token authentication filter. Requires a {@link PdsConfiguration}
 * block in the application's YAML config.
 * <p>
 * Embed in your application and let the configuration pick the collaborators:
 * <pre>{@code
 *   bootstrap.addBundle(new PdsBundle<>());
 * }</pre>
 * With {@code databasePath} and {@code plcUrl} set this uses SQLite and the PLC directory;
 * with either left empty it falls back to in-memory storage (dev/test only).
 * <p>
 * Or supply your own:
 * <pre>{@code
 *   bootstrap.addBundle(new PdsBundle<>(myDatabase, myPlcClient, myDidResolver, myHandleResolver));
 * }</pre>
 */
@Singleton
public class PdsBundle<C extends PdsConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(PdsBundle.class);

  private static final long DID_CACHE_SIZE = 10_000;
  private static final Duration DID_CACHE_TTL = Duration.ofHours(1);

  private final Database database;
  private final PlcClient plcClient;
  private final DidResolver didResolver;
  private final ExternalHandleResolver externalHandleResolver;

  /**
   * Creates a bundle whose database and PLC registry are built from the configuration.
   */
  public PdsBundle() {
    this.database = null;
    this.plcClient = null;
    this.didResolver = null;
    this.externalHandleResolver = null;
  }

  /**
   * Creates a bundle backed by the supplied collaborators. Configuration values for the
   * database and the PLC directory are ignored.
   *
   * @param database               account storage
   * @param plcClient              the PLC registry
   * @param didResolver            resolver for caller DIDs
   * @param externalHandleResolver resolver for handles on foreign domains
   * @throws NullPointerException if any collaborator is null
   */
  @Inject
  public PdsBundle(Database database,
                   PlcClient plcClient,
                   DidResolver didResolver,
                   ExternalHandleResolver externalHandleResolver) {
    this.database = Objects.requireNonNull(database, "database");
    this.plcClient = Objects.requireNonNull(plcClient, "plcClient");
    this.didResolver = Objects.requireNonNull(didResolver, "didResolver");
    this.externalHandleResolver = Objects.requireNonNull(externalHandleResolver, "externalHandleResolver");
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    Duration timeout = Duration.ofSeconds(configuration.getIdentityTimeoutSeconds());
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();

    Database db = database != null ? database : buildDatabase(configuration);
    PlcClient plc;
    DidResolver resolver;
    if (plcClient != null) {
      plc = plcClient;
      resolver = didResolver;
    } else if (isEmpty(configuration.getPlcUrl())) {
      log.warn("""
          #################################################################
          # WARNING: No plcUrl configured. Using an in-memory PLC         #
          # registry: minted DIDs exist only inside this process.         #
          # Do not use in production.                                     #
          #################################################################
          """);
      InMemoryPlcClient registry = new InMemoryPlcClient();
      plc = registry;
      resolver = registry;
    } else {
      plc = new HttpPlcClient(httpClient, environment.getObjectMapper(), configuration.getPlcUrl(), timeout);
      DidCache cache = new DidCache(DID_CACHE_TTL, DID_CACHE_SIZE);
      resolver = new AtprotoDidResolver(
          new PlcDidResolver(httpClient, environment.getObjectMapper(), configuration.getPlcUrl(), timeout, cache),
          new WebDidResolver(httpClient, environment.getObjectMapper(), timeout, cache));
    }
    ExternalHandleResolver handleResolver = externalHandleResolver != null
        ? externalHandleResolver
        : new WellKnownHandleResolver(httpClient, timeout);

    Keypair repoSigningKey = buildKeypair(configuration.getRepoSigningKeyHex(), "repoSigningKeyHex");
    Keypair plcRotationKey = buildKeypair(configuration.getPlcRotationKeyHex(), "plcRotationKeyHex");
    TokenManager tokenManager = buildTokenManager(configuration);

    ServiceContext ctx = new ServiceContext(
        buildServiceConfig(configuration),
        repoSigningKey,
        plcRotationKey,
        plc,
        resolver,
        handleResolver,
        db,
        new ScryptPasswordHasher(new SecureRandom(), configuration.getScryptCost()),
        tokenManager,
        new RepoManager(repoSigningKey),
        Clock.systemUTC());
    log.info("PDS serving {} for {} (repo key {}, rotation key {})", configuration.getPublicUrl(),
        configuration.getAvailableUserDomains(), repoSigningKey.did(), plcRotationKey.did());

    AccountRegistrationManager accountRegistrationManager = new AccountRegistrationManager(ctx);
    environment.jersey().register(new ServerResource(accountRegistrationManager));
    environment.jersey().register(new XrpcExceptionMapper());
    environment.healthChecks().register("pds-database", new DatabaseHealthCheck(db));

    // Bearer token auth filter for consumers' own routes
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<PdsPrincipal>()
            .setAuthenticator(new PdsAuthenticator(tokenManager))
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(PdsPrincipal.class));
  }

  private Database buildDatabase(C configuration) {
    String path = configuration.getDatabasePath();
    if (isEmpty(path)) {
      log.warn("""
          #################################################################
          # WARNING: Using an ephemeral in-memory account database.       #
          # All accounts will be lost on restart.                         #
          # Do not use in production.                                     #
          #################################################################
          """);
      return new InMemoryDatabase();
    }
    JdbcDatabase jdbc = new JdbcDatabase(JdbcDatabase.sqliteDataSource(path), SqlDialect.SQLITE);
    jdbc.initialize();
    return jdbc;
  }

  private Keypair buildKeypair(String hex, String property) {
    if (isEmpty(hex)) {
      log.warn("No {} configured: generating randomly. DIDs created by this node cannot be "
          + "updated after a restart. Do not use in production.", property);
      return EcKeypair.generate(KeyType.SECP256K1, new SecureRandom());
    }
    return EcKeypair.fromPrivateKeyHex(KeyType.SECP256K1, hex);
  }

  private TokenManager buildTokenManager(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (isEmpty(secretHex)) {
      log.warn("No JWT secret configured: generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new TokenManager(secret, configuration.getJwtIssuer(),
        Duration.ofSeconds(configuration.getAccessTokenTtlSeconds()),
        Duration.ofSeconds(configuration.getRefreshTokenTtlSeconds()),
        Clock.systemUTC());
  }

  private static ServiceConfig buildServiceConfig(PdsConfiguration configuration) {
    return new ServiceConfig(
        configuration.getPublicUrl(),
        configuration.getScheme(),
        configuration.getAvailableUserDomains(),
        configuration.getReservedHandles(),
        configuration.isInviteRequired(),
        isEmpty(configuration.getRecoveryKey()) ? null : configuration.getRecoveryKey());
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }
}
