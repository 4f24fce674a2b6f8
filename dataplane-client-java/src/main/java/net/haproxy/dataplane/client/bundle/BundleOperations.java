package net.haproxy.dataplane.client.bundle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import net.haproxy.dataplane.abstractions.data.AclPayload;
import net.haproxy.dataplane.abstractions.data.BackendPayload;
import net.haproxy.dataplane.abstractions.data.FrontendPayload;
import net.haproxy.dataplane.abstractions.data.ParentRef;
import net.haproxy.dataplane.abstractions.data.ServerPayload;
import net.haproxy.dataplane.abstractions.logging.ILog;
import net.haproxy.dataplane.abstractions.logging.LogManager;
import net.haproxy.dataplane.client.connection.IConfigurationCommands;
import net.haproxy.dataplane.client.transaction.RetryPolicy;
import net.haproxy.dataplane.client.transaction.RetryableErrorClassifier;
import net.haproxy.dataplane.client.transaction.Sleeper;
import net.haproxy.dataplane.client.transaction.TransactionManager;
import net.haproxy.dataplane.client.transaction.TransactionRetryExecutor;
import net.haproxy.dataplane.client.transaction.TransactionalWork;
import net.haproxy.dataplane.client.utils.CancellationTokenSource.CancellationToken;

import com.google.common.base.Preconditions;

/**
 * Creates, updates and deletes a {@link ResourceBundle} atomically, retrying on concurrent configuration changes.
 * Create and update go backend, servers, frontend, ACLs. Delete goes the opposite way.
 */
public class BundleOperations {

  private static final ILog log = LogManager.getCurrentClassLogger();

  private final IConfigurationCommands commands;
  private final RetryableErrorClassifier classifier;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public BundleOperations(IConfigurationCommands commands, RetryPolicy retryPolicy) {
    this(commands, new RetryableErrorClassifier(), retryPolicy, Sleeper.THREAD_SLEEPER);
  }

  public BundleOperations(IConfigurationCommands commands, RetryableErrorClassifier classifier, RetryPolicy retryPolicy, Sleeper sleeper) {
    this.commands = Preconditions.checkNotNull(commands, "commands");
    this.classifier = Preconditions.checkNotNull(classifier, "classifier");
    this.retryPolicy = Preconditions.checkNotNull(retryPolicy, "retryPolicy");
    this.sleeper = Preconditions.checkNotNull(sleeper, "sleeper");
  }

  public void create(ResourceBundle bundle) {
    create(bundle, null);
  }

  public void create(ResourceBundle bundle, CancellationToken token) {
    run("Bundle creation", createSteps(bundle), token);
  }

  public void update(ResourceBundle bundle) {
    update(bundle, null);
  }

  public void update(ResourceBundle bundle, CancellationToken token) {
    run("Bundle update", updateSteps(bundle), token);
  }

  public void delete(ResourceBundle bundle) {
    delete(bundle, null);
  }

  public void delete(ResourceBundle bundle, CancellationToken token) {
    run("Bundle deletion", deleteSteps(bundle), token);
  }

  /**
   * Reads the committed state of the entities named in the bundle.
   * Entities that do not exist are left out of the result.
   */
  public ResourceBundle read(ResourceBundle bundle) {
    ResourceBundle result = new ResourceBundle();
    if (bundle.getBackend() != null) {
      result.setBackend(commands.getBackend(bundle.getBackend().getName()));
    }
    for (ServerResource server : bundle.getServers()) {
      ServerPayload current = commands.getServer(server.getParent(), server.getPayload().getName());
      if (current != null) {
        result.addServer(server.getParent(), current);
      }
    }
    if (bundle.getFrontend() != null) {
      result.setFrontend(commands.getFrontend(bundle.getFrontend().getName()));
    }
    Set<ParentRef> aclParents = new LinkedHashSet<>();
    for (AclResource acl : bundle.getAcls()) {
      aclParents.add(acl.getParent());
    }
    for (ParentRef parent : aclParents) {
      for (AclPayload acl : commands.getAcls(parent)) {
        result.addAcl(parent, acl);
      }
    }
    return result;
  }

  private void run(String operation, final List<BundleStep> steps, final CancellationToken token) {
    Preconditions.checkArgument(!steps.isEmpty(), "Bundle is empty");
    final IConfigurationCommands scopedCommands = commands.withCancellation(token);
    TransactionRetryExecutor executor = new TransactionRetryExecutor(new TransactionManager(scopedCommands), classifier, retryPolicy, sleeper);
    executor.execute(operation, new TransactionalWork<Void>() {
      @Override
      public Void run(String transactionId) {
        for (BundleStep step : steps) {
          if (token != null) {
            token.throwIfCancellationRequested();
          }
          step.run(scopedCommands, transactionId);
        }
        return null;
      }
    }, token);
  }

  List<BundleStep> createSteps(ResourceBundle bundle) {
    List<BundleStep> steps = new ArrayList<>();
    final BackendPayload backend = bundle.getBackend();
    if (backend != null) {
      steps.add(new BundleStep("Backend " + backend.getName() + " creation") {
        @Override
        protected void execute(IConfigurationCommands commands, String transactionId) {
          commands.createBackend(backend, transactionId);
        }
      });
    }
    int position = 1;
    for (final ServerResource server : bundle.getServers()) {
      steps.add(new BundleStep("Server " + position++ + " (" + server.getPayload().getName() + ") creation") {
        @Override
        protected void execute(IConfigurationCommands commands, String transactionId) {
          commands.createServer(server.getParent(), server.getPayload(), transactionId);
        }
      });
    }
    final FrontendPayload frontend = bundle.getFrontend();
    if (frontend != null) {
      steps.add(new BundleStep("Frontend " + frontend.getName() + " creation") {
        @Override
        protected void execute(IConfigurationCommands commands, String transactionId) {
          commands.createFrontend(frontend, transactionId);
        }
      });
    }
    position = 1;
    for (final AclResource acl : bundle.getAcls()) {
      steps.add(new BundleStep("ACL " + position++ + " (" + acl.getPayload().getAclName() + ") creation") {
        @Override
        protected void execute(IConfigurationCommands commands, String transactionId) {
          commands.createAcl(acl.getParent(), acl.getPayload(), transactionId);
        }
      });
    }
    return steps;
  }

  List<BundleStep> updateSteps(ResourceBundle bundle) {
    List<BundleStep> steps = new ArrayList<>();
    final BackendPayload backend = bundle.getBackend();
    if (backend != null) {
      steps.add(new BundleStep("Backend " + backend.getName() + " update") {
        @Override
        protected void execute(IConfigurationCommands commands, String transactionId) {
          commands.updateBackend(backend, transactionId);
        }
      });
    }
    int position = 1;
    for (final ServerResource server : bundle.getServers()) {
      steps.add(new BundleStep("Server " + position++ + " (" + server.getPayload().getName() + ") update") {
        @Override
        protected void execute(IConfigurationCommands commands, String transactionId) {
          commands.updateServer(server.getParent(), server.getPayload(), transactionId);
        }
      });
    }
    final FrontendPayload frontend = bundle.getFrontend();
    if (frontend != null) {
      steps.add(new BundleStep("Frontend " + frontend.getName() + " update") {
        @Override
        protected void execute(IConfigurationCommands commands, String transactionId) {
          commands.updateFrontend(frontend, transactionId);
        }
      });
    }
    position = 1;
    for (final AclResource acl : bundle.getAcls()) {
      steps.add(new BundleStep("ACL " + position++ + " (" + acl.getPayload().getAclName() + ") update") {
        @Override
        protected void execute(IConfigurationCommands commands, String transactionId) {
          commands.updateAcl(acl.getParent(), acl.getPayload(), transactionId);
        }
      });
    }
    return steps;
  }

  /**
   * ACLs go first, highest index first, so removing one does not shift the index of those still to delete.
   */
  List<BundleStep> deleteSteps(final ResourceBundle bundle) {
    List<BundleStep> steps = new ArrayList<>();
    List<AclResource> acls = new ArrayList<>(bundle.getAcls());
    Collections.sort(acls, new Comparator<AclResource>() {
      @Override
      public int compare(AclResource o1, AclResource o2) {
        return o2.getPayload().getIndex().compareTo(o1.getPayload().getIndex());
      }
    });
    for (final AclResource acl : acls) {
      steps.add(new BundleStep("ACL " + (bundle.getAcls().indexOf(acl) + 1) + " (" + acl.getPayload().getAclName() + ") deletion") {
        @Override
        protected void execute(IConfigurationCommands commands, String transactionId) {
          int index = acl.getPayload().getIndex();
          try {
            commands.deleteAcl(acl.getParent(), index, transactionId);
          } catch (RuntimeException e) {
            if (!classifier.isMissingObject(e)) {
              throw e;
            }
            log.warn("ACL %d (%s) of %s is already gone, skipping: %s", index, acl.getPayload().getAclName(), acl.getParent(), e.getMessage());
          }
        }
      });
    }
    final FrontendPayload frontend = bundle.getFrontend();
    if (frontend != null) {
      steps.add(new BundleStep("Frontend " + frontend.getName() + " deletion") {
        @Override
        protected void execute(IConfigurationCommands commands, String transactionId) {
          commands.deleteFrontend(frontend.getName(), transactionId);
        }
      });
    }
    List<ServerResource> servers = new ArrayList<>(bundle.getServers());
    Collections.reverse(servers);
    int position = servers.size();
    for (final ServerResource server : servers) {
      steps.add(new BundleStep("Server " + position-- + " (" + server.getPayload().getName() + ") deletion") {
        @Override
        protected void execute(IConfigurationCommands commands, String transactionId) {
          commands.deleteServer(server.getParent(), server.getPayload().getName(), transactionId);
        }
      });
    }
    final BackendPayload backend = bundle.getBackend();
    if (backend != null) {
      steps.add(new BundleStep("Backend " + backend.getName() + " deletion") {
        @Override
        protected void execute(IConfigurationCommands commands, String transactionId) {
          commands.deleteBackend(backend.getName(), transactionId);
        }
      });
    }
    return steps;
  }
}
