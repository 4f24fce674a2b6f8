package net.haproxy.dataplane.client.bundle;

import net.haproxy.dataplane.abstractions.data.ParentRef;
import net.haproxy.dataplane.abstractions.data.ServerPayload;

import com.google.common.base.Preconditions;

public class ServerResource {
  private final ParentRef parent;
  private final ServerPayload payload;

  public ServerResource(ParentRef parent, ServerPayload payload) {
    this.parent = Preconditions.checkNotNull(parent, "parent");
    this.payload = Preconditions.checkNotNull(payload, "payload");
  }

  public ParentRef getParent() {
    return parent;
  }

  public ServerPayload getPayload() {
    return payload;
  }
}
