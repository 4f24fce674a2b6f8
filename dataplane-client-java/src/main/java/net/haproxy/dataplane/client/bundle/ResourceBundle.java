package net.haproxy.dataplane.client.bundle;

import java.util.ArrayList;
import java.util.List;

import net.haproxy.dataplane.abstractions.data.AclPayload;
import net.haproxy.dataplane.abstractions.data.BackendPayload;
import net.haproxy.dataplane.abstractions.data.FrontendPayload;
import net.haproxy.dataplane.abstractions.data.ParentRef;
import net.haproxy.dataplane.abstractions.data.ServerPayload;

/**
 * Related entities applied together in one transaction: a backend, its servers, a frontend and its ACLs.
 * Every part is optional. Servers and ACLs keep the order they were added in.
 */
public class ResourceBundle {

  private BackendPayload backend;
  private final List<ServerResource> servers = new ArrayList<>();
  private FrontendPayload frontend;
  private final List<AclResource> acls = new ArrayList<>();

  public BackendPayload getBackend() {
    return backend;
  }

  public ResourceBundle setBackend(BackendPayload backend) {
    this.backend = backend;
    return this;
  }

  public List<ServerResource> getServers() {
    return servers;
  }

  public ResourceBundle addServer(ParentRef parent, ServerPayload server) {
    servers.add(new ServerResource(parent, server));
    return this;
  }

  public FrontendPayload getFrontend() {
    return frontend;
  }

  public ResourceBundle setFrontend(FrontendPayload frontend) {
    this.frontend = frontend;
    return this;
  }

  public List<AclResource> getAcls() {
    return acls;
  }

  public ResourceBundle addAcl(ParentRef parent, AclPayload acl) {
    acls.add(new AclResource(parent, acl));
    return this;
  }

  public boolean isEmpty() {
    return backend == null && frontend == null && servers.isEmpty() && acls.isEmpty();
  }
}
