package com.codeheadsystems.pds.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.pds.server.db.Database;

/**
 * Health check that verifies the account database answers a read.
 */
public class DatabaseHealthCheck extends HealthCheck {

  private static final String PROBE_DID = "did:plc:healthcheck";

  private final Database database;

  /**
   * Instantiates a new Database health check.
   *
   * @param database the database
   */
  public DatabaseHealthCheck(Database database) {
    this.database = database;
  }

  @Override
  protected Result check() {
    boolean found = database.read(stores -> stores.accounts().getAccount(PROBE_DID, true).isPresent());
    return Result.healthy("probe account present=%s", found);
  }
}
