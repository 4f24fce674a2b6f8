package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class PeerEntryPayload implements NamedPayload {
  private String name;
  private String address;
  private Long port;

  public PeerEntryPayload() {
    super();
  }

  public PeerEntryPayload(String name, String address, Long port) {
    super();
    this.name = name;
    this.address = address;
    this.port = port;
  }

  @Override
  @JsonProperty("name")
  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @JsonProperty("address")
  public String getAddress() {
    return address;
  }

  public void setAddress(String address) {
    this.address = address;
  }

  @JsonProperty("port")
  public Long getPort() {
    return port;
  }

  public void setPort(Long port) {
    this.port = port;
  }
}
