package org.hypertrace.core.select.service.api;

import com.google.common.base.Preconditions;
import lombok.Value;

/** Tenant scope every storage request is restricted to. */
@Value
public class AuthToken {
  int accountId;
  int projectId;

  public static AuthToken of(int accountId, int projectId) {
    Preconditions.checkArgument(accountId >= 0, "accountId must be non-negative");
    Preconditions.checkArgument(projectId >= 0, "projectId must be non-negative");
    return new AuthToken(accountId, projectId);
  }

  @Override
  public String toString() {
    return accountId + ":" + projectId;
  }
}
