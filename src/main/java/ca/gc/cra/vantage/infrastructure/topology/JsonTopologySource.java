package ca.gc.cra.vantage.infrastructure.topology;

import static ca.gc.cra.vantage.infrastructure.json.JsonSupport.asObject;
import static ca.gc.cra.vantage.infrastructure.json.JsonSupport.optionalInt;
import static ca.gc.cra.vantage.infrastructure.json.JsonSupport.optionalList;
import static ca.gc.cra.vantage.infrastructure.json.JsonSupport.optionalString;
import static ca.gc.cra.vantage.infrastructure.json.JsonSupport.requireInt;
import static ca.gc.cra.vantage.infrastructure.json.JsonSupport.toInt;

import ca.gc.cra.vantage.application.port.TopologySource;
import ca.gc.cra.vantage.domain.topology.PodNode;
import ca.gc.cra.vantage.domain.topology.TopologySnapshot;
import ca.gc.cra.vantage.domain.topology.VInterface;
import ca.gc.cra.vantage.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TopologySource} reading a topology snapshot from a JSON file.
 * <p><strong>Format:</strong> a root object with optional arrays {@code vinterfaces}, {@code hosts},
 * {@code gatewayHosts}, {@code vms}, {@code podNodes}, and {@code pods}. Devices reference interfaces by id
 * through their own {@code vinterfaces} arrays; unknown ids are skipped.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Logs skipped references at DEBUG and a per-load summary at INFO.</p>
 *
 * @since 0.1.0
 */
public final class JsonTopologySource implements TopologySource {
  private static final Logger log = LoggerFactory.getLogger(JsonTopologySource.class);

  private final Path path;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates a source bound to {@code path}.
   *
   * @param path topology JSON file; must not be {@code null}
   */
  public JsonTopologySource(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public TopologySnapshot load() throws IOException {
    Map<String, Object> root;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      root = json.parseObject(reader);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Failed to parse topology at " + path + ": " + ex.getMessage(), ex);
    }
    try {
      TopologySnapshot snapshot = toSnapshot(root);
      log.info("Loaded topology from {}: {} vinterfaces, {} hosts, {} vms, {} pod nodes",
          path,
          snapshot.deviceVInterfaces().size(),
          snapshot.hostVInterfaces().size(),
          snapshot.vmVInterfaces().size(),
          snapshot.podNodes().size());
      return snapshot;
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Invalid topology at " + path + ": " + ex.getMessage(), ex);
    }
  }

  static TopologySnapshot toSnapshot(Map<String, Object> root) {
    TopologySnapshot.Builder builder = TopologySnapshot.builder();
    Map<Integer, VInterface> byId = new HashMap<>();

    List<Object> vifs = optionalList(root, "vinterfaces", "$");
    for (int i = 0; i < vifs.size(); i++) {
      String at = "$.vinterfaces[" + i + "]";
      Map<String, Object> node = asObject(vifs.get(i), at);
      VInterface vif = new VInterface(
          requireInt(node, "id", at), optionalString(node, "mac", at), optionalInt(node, "networkId", at, 0));
      if (byId.putIfAbsent(vif.id(), vif) != null) {
        throw new IllegalArgumentException(at + ".id duplicates vinterface " + vif.id());
      }
      builder.deviceVInterface(vif);
    }

    List<Object> hosts = optionalList(root, "hosts", "$");
    for (int i = 0; i < hosts.size(); i++) {
      String at = "$.hosts[" + i + "]";
      Map<String, Object> node = asObject(hosts.get(i), at);
      int hostId = requireInt(node, "id", at);
      attach(node, at, byId, vif -> builder.hostVInterface(hostId, vif));
    }

    List<Object> gateways = optionalList(root, "gatewayHosts", "$");
    for (int i = 0; i < gateways.size(); i++) {
      String at = "$.gatewayHosts[" + i + "]";
      Map<String, Object> node = asObject(gateways.get(i), at);
      int gatewayId = requireInt(node, "id", at);
      attach(node, at, byId, vif -> builder.gatewayHostVInterface(gatewayId, vif));
    }

    List<Object> vms = optionalList(root, "vms", "$");
    for (int i = 0; i < vms.size(); i++) {
      String at = "$.vms[" + i + "]";
      Map<String, Object> node = asObject(vms.get(i), at);
      int vmId = requireInt(node, "id", at);
      String launchServer = optionalString(node, "launchServer", at).trim();
      if (!launchServer.isEmpty()) {
        builder.launchServerVm(launchServer, vmId);
      }
      attach(node, at, byId, vif -> builder.vmVInterface(vmId, vif));
    }

    List<Object> podNodes = optionalList(root, "podNodes", "$");
    for (int i = 0; i < podNodes.size(); i++) {
      String at = "$.podNodes[" + i + "]";
      Map<String, Object> node = asObject(podNodes.get(i), at);
      int podNodeId = requireInt(node, "id", at);
      builder.podNode(new PodNode(podNodeId, optionalString(node, "name", at)));
      if (node.get("vmId") != null) {
        builder.podNodeVm(podNodeId, requireInt(node, "vmId", at));
      }
      attach(node, at, byId, vif -> builder.podNodeVInterface(podNodeId, vif));
    }

    List<Object> pods = optionalList(root, "pods", "$");
    for (int i = 0; i < pods.size(); i++) {
      String at = "$.pods[" + i + "]";
      Map<String, Object> node = asObject(pods.get(i), at);
      int podId = requireInt(node, "id", at);
      if (node.get("podNodeId") != null) {
        builder.podNodePod(requireInt(node, "podNodeId", at), podId);
      }
      attach(node, at, byId, vif -> builder.podVInterface(podId, vif));
    }
    return builder.build();
  }

  private static void attach(
      Map<String, Object> node,
      String at,
      Map<Integer, VInterface> byId,
      Consumer<VInterface> sink) {
    List<Object> ids = optionalList(node, "vinterfaces", at);
    for (int i = 0; i < ids.size(); i++) {
      int vifId = toInt(ids.get(i), at + ".vinterfaces[" + i + "]");
      VInterface vif = byId.get(vifId);
      if (vif == null) {
        log.debug("{} references unknown vinterface {}; skipping", at, vifId);
        continue;
      }
      sink.accept(vif);
    }
  }
}
