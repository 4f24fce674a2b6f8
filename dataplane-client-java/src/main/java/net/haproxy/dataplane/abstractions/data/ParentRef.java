package net.haproxy.dataplane.abstractions.data;

import org.apache.commons.lang.StringUtils;

import com.google.common.base.Preconditions;

/**
 * Configuration section owning a child entity, e.g. the backend a server belongs to.
 */
public class ParentRef {

  private final String type;
  private final String collection;
  private final String name;

  private ParentRef(String type, String collection, String name) {
    Preconditions.checkArgument(StringUtils.isNotBlank(name), "Parent name can not be blank");
    this.type = type;
    this.collection = collection;
    this.name = name;
  }

  public static ParentRef frontend(String name) {
    return new ParentRef("frontend", "frontends", name);
  }

  public static ParentRef backend(String name) {
    return new ParentRef("backend", "backends", name);
  }

  public static ParentRef resolver(String name) {
    return new ParentRef("resolver", "resolvers", name);
  }

  public static ParentRef peers(String name) {
    return new ParentRef("peers", "peers", name);
  }

  /**
   * Parses the <code>parent_type</code> value used by the API.
   */
  public static ParentRef of(String type, String name) {
    switch (StringUtils.defaultString(type).toLowerCase()) {
      case "frontend":
        return frontend(name);
      case "backend":
        return backend(name);
      case "resolver":
        return resolver(name);
      case "peers":
        return peers(name);
      default:
        throw new IllegalArgumentException("Unknown parent type: " + type);
    }
  }

  /**
   * @return value of the <code>parent_type</code> query parameter
   */
  public String getType() {
    return type;
  }

  /**
   * @return path segment of the parent's collection
   */
  public String getCollection() {
    return collection;
  }

  public String getName() {
    return name;
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ParentRef)) {
      return false;
    }
    ParentRef other = (ParentRef) obj;
    return type.equals(other.type) && name.equals(other.name);
  }

  @Override
  public String toString() {
    return type + " " + name;
  }
}
