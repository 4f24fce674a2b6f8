package net.haproxy.dataplane.abstractions.data;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang.BooleanUtils;
import org.apache.commons.lang.StringUtils;

/**
 * Parses <code>Url=https://lb:5555;Username=admin;Password=secret;ApiVersion=v3;Insecure=true</code>.
 */
public class ConnectionStringParser {

  public static ConnectionStringParser fromConnectionString(String connString) {
    return new ConnectionStringParser(connString);
  }

  private static Pattern connectionStringRegex = Pattern.compile("(\\w+)\\s*=\\s*(.*)");

  private final String connectionString;

  private boolean setupPasswordInConnectionString;
  private boolean setupUsernameInConnectionString;

  private final DataPlaneConnectionStringOptions connectionStringOptions = new DataPlaneConnectionStringOptions();

  public DataPlaneConnectionStringOptions getConnectionStringOptions() {
    return connectionStringOptions;
  }

  private ConnectionStringParser(String connectionString) {
    this.connectionString = connectionString;
  }

  /**
   * Parse the connection string option
   * @param key
   * @param value
   */
  protected void processConnectionStringOption(String key, String value) {
    switch (key)
    {
      case "url":
        connectionStringOptions.setUrl(value);
        break;
      case "user":
      case "username":
        connectionStringOptions.setUsername(value);
        setupUsernameInConnectionString = true;
        break;
      case "password":
        connectionStringOptions.setPassword(value);
        setupPasswordInConnectionString = true;
        break;
      case "insecure":
        connectionStringOptions.setInsecure(parseBoolean(key, value));
        break;
      case "apiversion":
        connectionStringOptions.setApiVersion(ApiVersion.fromString(value));
        break;
      case "maxattempts":
        connectionStringOptions.setMaxAttempts(parsePositiveInt(key, value));
        break;
      case "retrydelay":
        connectionStringOptions.setRetryDelayMillis((long) parsePositiveInt(key, value));
        break;
      case "timeout":
        connectionStringOptions.setTimeoutMillis(parsePositiveInt(key, value));
        break;
      default:
        throw new IllegalArgumentException(String.format("Connection string : '%s' could not be parsed, unknown option: '%s'", mask(connectionString), key));
    }
  }

  public void parse() {
    if (StringUtils.isBlank(connectionString)) {
      throw new IllegalArgumentException("connection string is blank.");
    }
    String[] strings = connectionString.split(";");
    for (String str: strings) {
      String arg = str.trim();
      if (StringUtils.isEmpty(arg)) {
        continue;
      }
      if (!arg.contains("=")) {
        throw new IllegalArgumentException(String.format("Connection string : '%s' could not be parsed, option without value: '%s'", mask(connectionString), mask(arg)));
      }
      Matcher matcher = connectionStringRegex.matcher(arg);
      if (!matcher.matches()) {
        throw new IllegalArgumentException(String.format("Connection string name: '%s' could not be parsed", mask(connectionString)));
      }
      processConnectionStringOption(matcher.group(1).toLowerCase(), matcher.group(2).trim());
    }

    if (setupUsernameInConnectionString == false && setupPasswordInConnectionString == false)
      return;

    if (setupUsernameInConnectionString == false || setupPasswordInConnectionString == false) {
      throw new IllegalArgumentException(String.format("User and Password must both be specified in the connection string: '%s'", mask(connectionString)));
    }
  }

  private static Boolean parseBoolean(String key, String value) {
    Boolean result = BooleanUtils.toBooleanObject(value);
    if (result == null) {
      throw new IllegalArgumentException(String.format("Option '%s' expects true or false, got: '%s'", key, value));
    }
    return result;
  }

  private static int parsePositiveInt(String key, String value) {
    try {
      int result = Integer.parseInt(value);
      if (result < 0) {
        throw new IllegalArgumentException(String.format("Option '%s' can not be negative: '%s'", key, value));
      }
      return result;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format("Option '%s' expects a number, got: '%s'", key, value), e);
    }
  }

  private static String mask(String connectionString) {
    return connectionString.replaceAll("(?i)(password\\s*=\\s*)[^;]*", "$1***");
  }

}
