package net.haproxy.dataplane.abstractions.connection;

import java.nio.charset.StandardCharsets;

import org.apache.commons.codec.binary.Base64;

/**
 * Basic authentication credentials of the Data Plane API user.
 */
public class OperationCredentials {
  private final String username;
  private final String password;

  public OperationCredentials(String username, String password) {
    super();
    this.username = username;
    this.password = password;
  }

  public String getUsername() {
    return username;
  }

  public String getPassword() {
    return password;
  }

  /**
   * @return value of the Authorization header
   */
  public String toBasicAuthorizationHeader() {
    String token = username + ":" + password;
    return "Basic " + Base64.encodeBase64String(token.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public String toString() {
    return "OperationCredentials [username=" + username + ", password=***]";
  }

}
