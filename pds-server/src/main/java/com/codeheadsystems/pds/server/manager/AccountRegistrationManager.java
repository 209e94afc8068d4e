package com.codeheadsystems.pds.server.manager;

import static com.codeheadsystems.pds.server.exception.RegistrationError.INVALID_INVITE_CODE;
import static com.codeheadsystems.pds.server.exception.RegistrationError.INVALID_REQUEST;

import com.codeheadsystems.pds.identity.plc.PlcOperation;
import com.codeheadsystems.pds.model.server.CreateAccountRequest;
import com.codeheadsystems.pds.model.server.CreateAccountResponse;
import com.codeheadsystems.pds.model.server.GetSessionResponse;
import com.codeheadsystems.pds.server.ServiceConfig;
import com.codeheadsystems.pds.server.ServiceContext;
import com.codeheadsystems.pds.server.auth.TokenManager;
import com.codeheadsystems.pds.server.db.Stores;
import com.codeheadsystems.pds.server.exception.AccountConflict;
import com.codeheadsystems.pds.server.exception.RegistrationException;
import com.codeheadsystems.pds.server.exception.UserAlreadyExistsException;
import com.codeheadsystems.pds.server.registration.DidProvisioner;
import com.codeheadsystems.pds.server.registration.HandleValidator;
import com.codeheadsystems.pds.server.registration.InviteAdmissionController;
import com.codeheadsystems.pds.server.registration.ProvisionedDid;
import com.codeheadsystems.pds.server.store.Account;
import com.codeheadsystems.pds.server.store.InviteCodeUse;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic account registration and session lookup.
 * <p>
 * Registration validates the handle, pre-checks the invite code, provisions the DID and
 * hashes the password before opening a transaction. Inside one transaction it re-checks the
 * invite code under a row lock, inserts the account, submits a pending PLC operation,
 * records the invite use, creates the repository and grants the refresh token. A failure
 * anywhere in the transaction leaves none of those rows behind. A PLC operation that was
 * already accepted by the registry is not compensated.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link RegistrationException}: refused because of the request → HTTP 400 with the
 *   XRPC error name of its {@link com.codeheadsystems.pds.server.exception.RegistrationError}</li>
 *   <li>{@link SecurityException}: missing, invalid or expired access token → HTTP 401</li>
 *   <li>any other {@link RuntimeException}: registry or storage failure → HTTP 500</li>
 * </ul>
 */
public class AccountRegistrationManager {

  private static final Logger log = LoggerFactory.getLogger(AccountRegistrationManager.class);

  private final ServiceContext ctx;
  private final HandleValidator handleValidator;
  private final DidProvisioner didProvisioner;
  private final InviteAdmissionController inviteAdmissionController;

  /**
   * Instantiates a new Account registration manager with the default components.
   *
   * @param ctx the service context
   */
  public AccountRegistrationManager(ServiceContext ctx) {
    this(ctx,
        new HandleValidator(ctx.config(), ctx.externalHandleResolver()),
        new DidProvisioner(ctx.config(), ctx.repoSigningKey(), ctx.plcRotationKey(), ctx.plcClient(),
            ctx.didResolver()),
        new InviteAdmissionController());
  }

  /**
   * Instantiates a new Account registration manager.
   *
   * @param ctx                       the service context
   * @param handleValidator           handle validation
   * @param didProvisioner            DID provisioning
   * @param inviteAdmissionController invite checks
   */
  public AccountRegistrationManager(ServiceContext ctx,
                                    HandleValidator handleValidator,
                                    DidProvisioner didProvisioner,
                                    InviteAdmissionController inviteAdmissionController) {
    this.ctx = ctx;
    this.handleValidator = handleValidator;
    this.didProvisioner = didProvisioner;
    this.inviteAdmissionController = inviteAdmissionController;
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Registers a new account.
   *
   * @param request the request
   * @return the DID, the normalized handle and a session
   * @throws RegistrationException if the request is refused
   */
  public CreateAccountResponse register(CreateAccountRequest request) {
    log.debug("register({})", request);
    ServiceConfig config = ctx.config();
    Optional<String> inviteCode = request.inviteCodeOptional();
    if (config.inviteRequired() && inviteCode.isEmpty()) {
      throw new RegistrationException(INVALID_INVITE_CODE, "No invite code provided");
    }
    String email = required(request.email(), "email").toLowerCase(Locale.ROOT);
    String password = required(request.password(), "password");
    String callerDid = request.didOptional().orElse(null);

    String handle = handleValidator.validate(request.handle(), callerDid);

    if (config.inviteRequired()) {
      ctx.database().read(stores -> {
        inviteAdmissionController.checkAvailable(stores, inviteCode.get(), false);
        return null;
      });
    }

    ProvisionedDid provisioned = didProvisioner.provision(handle, callerDid,
        request.recoveryKeyOptional().orElse(null));
    String did = provisioned.did();
    String passwordHash = ctx.passwordHasher().hash(password);
    Instant now = ctx.clock().instant();

    CreateAccountResponse response = ctx.database().transaction(stores -> {
      if (config.inviteRequired()) {
        inviteAdmissionController.checkAvailable(stores, inviteCode.get(), true);
      }

      try {
        stores.accounts().registerUser(email, handle, did, passwordHash, now);
      } catch (UserAlreadyExistsException e) {
        AccountConflict conflict = classifyConflict(stores, handle, did, email);
        log.info("Registration of {} refused: {} taken", handle, conflict);
        throw conflict.toException(switch (conflict) {
          case HANDLE -> handle;
          case EMAIL -> email;
          case DID -> did;
        });
      }

      Optional<PlcOperation> pendingOp = provisioned.pendingOperation();
      if (pendingOp.isPresent()) {
        try {
          ctx.plcClient().sendOperation(did, pendingOp.get());
        } catch (RuntimeException e) {
          log.error("failed to create did:plc didKey={} handle={}", ctx.plcRotationKey().did(), handle, e);
          throw e;
        }
      }

      if (config.inviteRequired()) {
        stores.invites().recordUse(new InviteCodeUse(inviteCode.get(), did, now));
      }

      ctx.repoManager().createRepo(stores, did, List.of(), now);

      TokenManager.AccessToken access = ctx.tokenManager().createAccessToken(did);
      TokenManager.RefreshToken refresh = ctx.tokenManager().createRefreshToken(did);
      stores.refreshTokens().grant(refresh.payload());

      return new CreateAccountResponse(handle, did, access.jwt(), refresh.jwt());
    });
    log.info("Registered {} as {}", handle, did);
    return response;
  }

  // ── Session ──────────────────────────────────────────────────────────────

  /**
   * Describes the account behind an access token.
   *
   * @param accessToken the bearer token, without the {@code Bearer } prefix
   * @return the account's handle, DID and email
   * @throws SecurityException if the token is missing, invalid or expired, or the account is
   *                           gone
   */
  public GetSessionResponse getSession(String accessToken) {
    log.debug("getSession()");
    if (accessToken == null || accessToken.isBlank()) {
      throw new SecurityException("Authentication required");
    }
    String did = ctx.tokenManager().verifyAccessToken(accessToken)
        .orElseThrow(() -> new SecurityException("Authentication failed"));
    Account account = ctx.database().read(stores -> stores.accounts().getAccount(did, false))
        .orElseThrow(() -> new SecurityException("Account not found"));
    return new GetSessionResponse(account.handle(), account.did(), account.email());
  }

  /**
   * Works out which unique column a rejected insert collided with. The store only reports
   * that one did, so each column is looked up again. A claim that is not visible yet belongs
   * to a concurrent registration still in flight, which is reported as a handle conflict.
   */
  private AccountConflict classifyConflict(Stores stores, String handle, String did, String email) {
    if (stores.accounts().getAccount(handle, true).isPresent()) {
      return AccountConflict.HANDLE;
    }
    if (stores.accounts().getAccount(did, true).isPresent()) {
      return AccountConflict.DID;
    }
    if (stores.accounts().getAccountByEmail(email, true).isPresent()) {
      return AccountConflict.EMAIL;
    }
    return AccountConflict.HANDLE;
  }

  private static String required(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new RegistrationException(INVALID_REQUEST, "Missing required field: " + field);
    }
    return value;
  }
}
