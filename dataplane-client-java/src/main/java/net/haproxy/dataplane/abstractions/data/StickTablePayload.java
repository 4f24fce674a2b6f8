package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class StickTablePayload implements NamedPayload {
  private String name;
  private String type;
  private String size;
  private String store;
  private String peers;
  private Boolean noPurge;

  public StickTablePayload() {
    super();
  }

  public StickTablePayload(String name) {
    super();
    this.name = name;
  }

  @Override
  @JsonProperty("name")
  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @JsonProperty("type")
  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  @JsonProperty("size")
  public String getSize() {
    return size;
  }

  public void setSize(String size) {
    this.size = size;
  }

  @JsonProperty("store")
  public String getStore() {
    return store;
  }

  public void setStore(String store) {
    this.store = store;
  }

  @JsonProperty("peers")
  public String getPeers() {
    return peers;
  }

  public void setPeers(String peers) {
    this.peers = peers;
  }

  @JsonProperty("no_purge")
  public Boolean getNoPurge() {
    return noPurge;
  }

  public void setNoPurge(Boolean noPurge) {
    this.noPurge = noPurge;
  }
}
