package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

/**
 * Named ACL of a frontend or backend, addressed by its index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class AclPayload implements IndexedPayload {
  private String aclName;
  private Integer index;
  private String criterion;
  private String value;

  public AclPayload() {
    super();
  }

  public AclPayload(String aclName, Integer index, String criterion, String value) {
    super();
    this.aclName = aclName;
    this.index = index;
    this.criterion = criterion;
    this.value = value;
  }

  @JsonProperty("acl_name")
  public String getAclName() {
    return aclName;
  }

  public void setAclName(String aclName) {
    this.aclName = aclName;
  }

  @Override
  @JsonProperty("index")
  public Integer getIndex() {
    return index;
  }

  public void setIndex(Integer index) {
    this.index = index;
  }

  @JsonProperty("criterion")
  public String getCriterion() {
    return criterion;
  }

  public void setCriterion(String criterion) {
    this.criterion = criterion;
  }

  @JsonProperty("value")
  public String getValue() {
    return value;
  }

  public void setValue(String value) {
    this.value = value;
  }
}
