package net.haproxy.dataplane.abstractions.data;

public class Constants {

  public static final String CONFIGURATION_PATH = "/services/haproxy/configuration";
  public static final String CONFIGURATION_VERSION_PATH = CONFIGURATION_PATH + "/version";
  public static final String TRANSACTIONS_PATH = "/services/haproxy/transactions";

  public static final String TRANSACTION_ID_PARAM = "transaction_id";
  public static final String VERSION_PARAM = "version";
  public static final String PARENT_TYPE_PARAM = "parent_type";
  public static final String PARENT_NAME_PARAM = "parent_name";

  public static final String DATA_ENVELOPE_FIELD = "data";

  public static final int DEFAULT_MAX_ATTEMPTS = 10;
  public static final long DEFAULT_RETRY_DELAY_MILLIS = 2000;
  public static final int DEFAULT_REQUEST_TIMEOUT_MILLIS = 30000;

  public static final String CLIENT_USER_AGENT = "haproxy-dataplane-java-client";
}
