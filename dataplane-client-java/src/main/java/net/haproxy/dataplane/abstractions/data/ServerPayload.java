package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class ServerPayload implements NamedPayload {
  private String name;
  private String address;
  private Long port;
  private String check;
  private String backup;
  private String maintenance;
  private String agentCheck;
  private String agentAddr;
  private Long agentPort;
  private Long agentInter;
  private Long inter;
  private Long fastinter;
  private Long downinter;
  private Long rise;
  private Long fall;
  private Long maxconn;
  private Long maxqueue;
  private Long minconn;
  private Long weight;
  private String cookie;
  private String initAddr;
  private Long healthCheckPort;
  private String ssl;
  private String sslCafile;
  private String sslCertificate;
  private String verify;
  private String sni;
  private String alpn;
  private String ciphers;
  private String ciphersuites;
  private String sslMinVer;
  private String sslMaxVer;
  private String sendProxy;

  public ServerPayload() {
    super();
  }

  public ServerPayload(String name, String address, Long port) {
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

  @JsonProperty("check")
  public String getCheck() {
    return check;
  }

  public void setCheck(String check) {
    this.check = check;
  }

  @JsonProperty("backup")
  public String getBackup() {
    return backup;
  }

  public void setBackup(String backup) {
    this.backup = backup;
  }

  @JsonProperty("maintenance")
  public String getMaintenance() {
    return maintenance;
  }

  public void setMaintenance(String maintenance) {
    this.maintenance = maintenance;
  }

  @JsonProperty("agent-check")
  public String getAgentCheck() {
    return agentCheck;
  }

  public void setAgentCheck(String agentCheck) {
    this.agentCheck = agentCheck;
  }

  @JsonProperty("agent-addr")
  public String getAgentAddr() {
    return agentAddr;
  }

  public void setAgentAddr(String agentAddr) {
    this.agentAddr = agentAddr;
  }

  @JsonProperty("agent-port")
  public Long getAgentPort() {
    return agentPort;
  }

  public void setAgentPort(Long agentPort) {
    this.agentPort = agentPort;
  }

  @JsonProperty("agent-inter")
  public Long getAgentInter() {
    return agentInter;
  }

  public void setAgentInter(Long agentInter) {
    this.agentInter = agentInter;
  }

  @JsonProperty("inter")
  public Long getInter() {
    return inter;
  }

  public void setInter(Long inter) {
    this.inter = inter;
  }

  @JsonProperty("fastinter")
  public Long getFastinter() {
    return fastinter;
  }

  public void setFastinter(Long fastinter) {
    this.fastinter = fastinter;
  }

  @JsonProperty("downinter")
  public Long getDowninter() {
    return downinter;
  }

  public void setDowninter(Long downinter) {
    this.downinter = downinter;
  }

  @JsonProperty("rise")
  public Long getRise() {
    return rise;
  }

  public void setRise(Long rise) {
    this.rise = rise;
  }

  @JsonProperty("fall")
  public Long getFall() {
    return fall;
  }

  public void setFall(Long fall) {
    this.fall = fall;
  }

  @JsonProperty("maxconn")
  public Long getMaxconn() {
    return maxconn;
  }

  public void setMaxconn(Long maxconn) {
    this.maxconn = maxconn;
  }

  @JsonProperty("maxqueue")
  public Long getMaxqueue() {
    return maxqueue;
  }

  public void setMaxqueue(Long maxqueue) {
    this.maxqueue = maxqueue;
  }

  @JsonProperty("minconn")
  public Long getMinconn() {
    return minconn;
  }

  public void setMinconn(Long minconn) {
    this.minconn = minconn;
  }

  @JsonProperty("weight")
  public Long getWeight() {
    return weight;
  }

  public void setWeight(Long weight) {
    this.weight = weight;
  }

  @JsonProperty("cookie")
  public String getCookie() {
    return cookie;
  }

  public void setCookie(String cookie) {
    this.cookie = cookie;
  }

  @JsonProperty("init-addr")
  public String getInitAddr() {
    return initAddr;
  }

  public void setInitAddr(String initAddr) {
    this.initAddr = initAddr;
  }

  @JsonProperty("health_check_port")
  public Long getHealthCheckPort() {
    return healthCheckPort;
  }

  public void setHealthCheckPort(Long healthCheckPort) {
    this.healthCheckPort = healthCheckPort;
  }

  @JsonProperty("ssl")
  public String getSsl() {
    return ssl;
  }

  public void setSsl(String ssl) {
    this.ssl = ssl;
  }

  @JsonProperty("ssl_cafile")
  public String getSslCafile() {
    return sslCafile;
  }

  public void setSslCafile(String sslCafile) {
    this.sslCafile = sslCafile;
  }

  @JsonProperty("ssl_certificate")
  public String getSslCertificate() {
    return sslCertificate;
  }

  public void setSslCertificate(String sslCertificate) {
    this.sslCertificate = sslCertificate;
  }

  @JsonProperty("verify")
  public String getVerify() {
    return verify;
  }

  public void setVerify(String verify) {
    this.verify = verify;
  }

  @JsonProperty("sni")
  public String getSni() {
    return sni;
  }

  public void setSni(String sni) {
    this.sni = sni;
  }

  @JsonProperty("alpn")
  public String getAlpn() {
    return alpn;
  }

  public void setAlpn(String alpn) {
    this.alpn = alpn;
  }

  @JsonProperty("ciphers")
  public String getCiphers() {
    return ciphers;
  }

  public void setCiphers(String ciphers) {
    this.ciphers = ciphers;
  }

  @JsonProperty("ciphersuites")
  public String getCiphersuites() {
    return ciphersuites;
  }

  public void setCiphersuites(String ciphersuites) {
    this.ciphersuites = ciphersuites;
  }

  @JsonProperty("ssl_min_ver")
  public String getSslMinVer() {
    return sslMinVer;
  }

  public void setSslMinVer(String sslMinVer) {
    this.sslMinVer = sslMinVer;
  }

  @JsonProperty("ssl_max_ver")
  public String getSslMaxVer() {
    return sslMaxVer;
  }

  public void setSslMaxVer(String sslMaxVer) {
    this.sslMaxVer = sslMaxVer;
  }

  @JsonProperty("send-proxy")
  public String getSendProxy() {
    return sendProxy;
  }

  public void setSendProxy(String sendProxy) {
    this.sendProxy = sendProxy;
  }
}
