package net.haproxy.dataplane.client.bundle;

import net.haproxy.dataplane.abstractions.data.AclPayload;
import net.haproxy.dataplane.abstractions.data.ParentRef;

import com.google.common.base.Preconditions;

public class AclResource {
  private final ParentRef parent;
  private final AclPayload payload;

  public AclResource(ParentRef parent, AclPayload payload) {
    this.parent = Preconditions.checkNotNull(parent, "parent");
    this.payload = Preconditions.checkNotNull(payload, "payload");
    Preconditions.checkArgument(payload.getIndex() != null, "ACL %s has no index", payload.getAclName());
  }

  public ParentRef getParent() {
    return parent;
  }

  public AclPayload getPayload() {
    return payload;
  }
}
