package net.haproxy.dataplane.abstractions.data;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang.StringUtils;

import com.google.common.base.Preconditions;

/**
 * Descriptor of a configuration entity exposed by the Data Plane API.
 * All resource operations are derived from this table instead of being written per type.
 */
public enum EntityType {
  FRONTEND("frontends", Kind.TOP_LEVEL, false, false, null),
  BACKEND("backends", Kind.TOP_LEVEL, false, false, null),
  RESOLVER("resolvers", Kind.TOP_LEVEL, false, false, null),
  PEERS("peers", Kind.TOP_LEVEL, false, false, null),
  LOG_FORWARD("log_forwards", Kind.TOP_LEVEL, false, false, null),
  STICK_TABLE("stick_tables", Kind.TOP_LEVEL, false, false, null),
  GLOBAL("global", Kind.SINGLETON, false, false, null),

  SERVER("servers", Kind.NESTED, false, false, null),
  BIND("binds", Kind.NESTED, false, false, null),
  ACL("acls", Kind.NESTED, true, false, null),
  HTTP_REQUEST_RULE("http_request_rules", Kind.NESTED, true, true, null),
  HTTP_RESPONSE_RULE("http_response_rules", Kind.NESTED, true, true, null),
  TCP_REQUEST_RULE("tcp_request_rules", Kind.NESTED, true, true, null),
  TCP_RESPONSE_RULE("tcp_response_rules", Kind.NESTED, true, true, null),
  HTTP_CHECK("http_checks", Kind.NESTED, true, true, null),
  TCP_CHECK("tcp_checks", Kind.NESTED, true, true, null),
  STICK_RULE("stick_rules", Kind.NESTED, true, true, "backend"),
  NAMESERVER("nameservers", Kind.NESTED, false, false, "resolver"),
  PEER_ENTRY("peer_entries", Kind.NESTED, false, false, "peers");

  public enum Kind {
    /**
     * Section of its own: <code>/configuration/backends/{name}</code>
     */
    TOP_LEVEL,
    /**
     * Lives inside a parent section
     */
    NESTED,
    /**
     * Exactly one instance, no key
     */
    SINGLETON
  }

  private final String collection;
  private final Kind kind;
  private final boolean indexed;
  private final boolean emptyOnUnprocessable;
  private final String legacyParentParam;

  private EntityType(String collection, Kind kind, boolean indexed, boolean emptyOnUnprocessable, String legacyParentParam) {
    this.collection = collection;
    this.kind = kind;
    this.indexed = indexed;
    this.emptyOnUnprocessable = emptyOnUnprocessable;
    this.legacyParentParam = legacyParentParam;
  }

  public String getCollection() {
    return collection;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * @return true when items are addressed by position rather than by name
   */
  public boolean isIndexed() {
    return indexed;
  }

  /**
   * The API answers 422 on rule and check lists of a section that has none of them yet.
   */
  public boolean isEmptyOnUnprocessable() {
    return emptyOnUnprocessable;
  }

  /**
   * Builds the logical path (without version prefix) of the collection, or of a single item when key is given.
   */
  public String buildPath(ApiVersion apiVersion, ParentRef parent, String key) {
    StringBuilder path = new StringBuilder(Constants.CONFIGURATION_PATH);
    switch (kind) {
      case SINGLETON:
        return path.append("/").append(collection).toString();
      case NESTED:
        Preconditions.checkArgument(parent != null, "%s requires a parent", this);
        if (apiVersion.usesNestedPaths()) {
          path.append("/").append(parent.getCollection()).append("/").append(parent.getName());
        }
        break;
      default:
        break;
    }
    path.append("/").append(collection);
    if (StringUtils.isNotEmpty(key)) {
      path.append("/").append(key);
    }
    return path.toString();
  }

  /**
   * Query parameters selecting the parent on API versions with flat paths. Empty otherwise.
   */
  public Map<String, String> buildParentQuery(ApiVersion apiVersion, ParentRef parent) {
    Map<String, String> query = new LinkedHashMap<>();
    if (kind != Kind.NESTED || apiVersion.usesNestedPaths()) {
      return query;
    }
    Preconditions.checkArgument(parent != null, "%s requires a parent", this);
    if (legacyParentParam != null) {
      query.put(legacyParentParam, parent.getName());
    } else {
      query.put(Constants.PARENT_TYPE_PARAM, parent.getType());
      query.put(Constants.PARENT_NAME_PARAM, parent.getName());
    }
    return query;
  }

  @Override
  public String toString() {
    return collection;
  }
}
