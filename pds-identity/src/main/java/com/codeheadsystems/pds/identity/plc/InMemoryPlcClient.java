package com.codeheadsystems.pds.identity.plc;

import com.codeheadsystems.pds.identity.did.AtprotoData;
import com.codeheadsystems.pds.identity.did.DidDocuments;
import com.codeheadsystems.pds.identity.did.DidResolutionException;
import com.codeheadsystems.pds.identity.did.DidResolver;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory PLC registry.
 * <p>
 * Checks operations the way the directory does: a genesis operation must hash to the DID it
 * is submitted for and be signed by one of its own rotation keys; an update must reference
 * the latest operation in {@code prev} and be signed by one of that operation's rotation
 * keys. Also resolves the DIDs it holds, so it can stand in for both the registry and the
 * did:plc resolver. All state is lost on restart. Suitable for development and testing only.
 */
public class InMemoryPlcClient implements PlcClient, DidResolver {
  private static final Logger log = LoggerFactory.getLogger(InMemoryPlcClient.class);

  private final ConcurrentHashMap<String, List<PlcOperation>> operations = new ConcurrentHashMap<>();

  /**
   * Instantiates a new In memory plc client.
   */
  public InMemoryPlcClient() {
    log.warn("InMemoryPlcClient in use: DID operations are not published and are lost on restart. "
        + "Not for production use.");
  }

  @Override
  public void sendOperation(final String did, final PlcOperation op) {
    log.debug("sendOperation(did={})", did);
    operations.compute(did, (key, history) -> {
      if (op.isGenesis()) {
        if (history != null) {
          throw new PlcClientException("DID already exists: " + did, 409);
        }
        if (!did.equals(PlcOperations.didForGenesis(op))) {
          throw new PlcClientException("Genesis operation does not match DID: " + did, 400);
        }
        requireSignature(did, op, op.rotationKeys());
        final List<PlcOperation> created = new CopyOnWriteArrayList<>();
        created.add(op);
        return created;
      }
      if (history == null) {
        throw new PlcClientException("DID not registered: " + did, 404);
      }
      final PlcOperation latest = history.get(history.size() - 1);
      if (!PlcOperations.cid(latest).toString().equals(op.prev())) {
        throw new PlcClientException("Operation prev does not match latest operation for " + did, 400);
      }
      requireSignature(did, op, latest.rotationKeys());
      history.add(op);
      return history;
    });
  }

  @Override
  public PlcDocumentData getDocumentData(final String did) {
    return latest(did)
        .map(op -> PlcDocumentData.fromOperation(did, op))
        .orElseThrow(() -> new PlcClientException("DID not registered: " + did, 404));
  }

  @Override
  public AtprotoData resolveAtprotoData(final String did) {
    final PlcOperation op = latest(did)
        .orElseThrow(() -> new DidResolutionException("Could not resolve DID: " + did));
    return DidDocuments.fromPlcData(PlcDocumentData.fromOperation(did, op));
  }

  /**
   * The operation log of a DID, oldest first.
   *
   * @param did the did
   * @return a copy of the log, empty if unknown
   */
  public List<PlcOperation> operationLog(final String did) {
    final List<PlcOperation> history = operations.get(did);
    return history == null ? List.of() : List.copyOf(history);
  }

  private Optional<PlcOperation> latest(final String did) {
    final List<PlcOperation> history = operations.get(did);
    return history == null ? Optional.empty() : Optional.of(history.get(history.size() - 1));
  }

  private static void requireSignature(final String did, final PlcOperation op, final List<String> keys) {
    if (!PlcOperations.verifySignature(op, keys)) {
      throw new PlcClientException("Invalid signature on operation for " + did, 400);
    }
  }
}
