// Copyright 2021 Jonathan Bluett-Duncan. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.github.jbduncan.layered.json;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import io.github.jbduncan.layered.Bounds;
import io.github.jbduncan.layered.CoordinateAssignment;
import io.github.jbduncan.layered.CrossingMinimization;
import io.github.jbduncan.layered.EdgeEndpoint;
import io.github.jbduncan.layered.GraphData;
import io.github.jbduncan.layered.GraphEdge;
import io.github.jbduncan.layered.GraphNode;
import io.github.jbduncan.layered.LayoutDirection;
import io.github.jbduncan.layered.LayoutOptions;
import io.github.jbduncan.layered.LayoutPreset;
import io.github.jbduncan.layered.LayoutResult;
import io.github.jbduncan.layered.LayoutStats;
import io.github.jbduncan.layered.Point;
import io.github.jbduncan.layered.RankingAlgorithm;
import io.github.jbduncan.layered.RoutedEdge;
import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads graphs and layout options from JSON and writes layout results to JSON.
 *
 * <p>A graph document looks like
 *
 * <pre>{@code
 * {
 *   "nodes": [{"id": "a", "label": "A"}, {"id": "b"}],
 *   "edges": [{"id": "e1", "source": "a", "target": {"id": "b"}}]
 * }
 * }</pre>
 *
 * <p>Edge endpoints are either node ids or node objects. Members other than {@code id}, {@code
 * source} and {@code target} are kept as display attributes and copied to the result. Edges
 * lacking an id or an endpoint are skipped; nodes lacking an id make the document invalid.
 *
 * <p>An options document is an object whose members are named like the {@link LayoutOptions}
 * properties and take the external identifiers of the enumerations, e.g. {@code {"preset": "dag",
 * "direction": "LR", "rankingAlgorithm": "tight-tree"}}. The optional {@code preset} member
 * selects the options the others override.
 */
public final class GraphJson {

  private static final Logger logger = LoggerFactory.getLogger(GraphJson.class);

  private static final ImmutableSet<String> NODE_MEMBERS = ImmutableSet.of("id");
  private static final ImmutableSet<String> EDGE_MEMBERS =
      ImmutableSet.of("id", "source", "target");

  private final Gson gson;

  public GraphJson() {
    this(false);
  }

  /** @param prettyPrinting whether written JSON is indented */
  public GraphJson(boolean prettyPrinting) {
    GsonBuilder builder =
        new GsonBuilder()
            .registerTypeAdapter(GraphData.class, new GraphDataDeserializer())
            .registerTypeAdapter(LayoutOptions.class, new LayoutOptionsDeserializer())
            .registerTypeAdapter(LayoutResult.class, new LayoutResultSerializer())
            .registerTypeAdapter(RoutedEdge.class, new RoutedEdgeSerializer())
            .registerTypeAdapter(Point.class, new PointSerializer())
            .registerTypeAdapter(Bounds.class, new BoundsSerializer())
            .registerTypeAdapter(LayoutStats.class, new LayoutStatsSerializer())
            .disableHtmlEscaping();
    if (prettyPrinting) {
      builder.setPrettyPrinting();
    }
    this.gson = builder.create();
  }

  public GraphData readGraph(Reader json) throws IOException, JsonParseException {
    return read(json, GraphData.class);
  }

  public LayoutOptions readOptions(Reader json) throws IOException, JsonParseException {
    return read(json, LayoutOptions.class);
  }

  public void writeResult(LayoutResult result, Appendable out) throws IOException {
    checkNotNull(result, "result");
    try {
      gson.toJson(result, LayoutResult.class, out);
    } catch (JsonIOException e) {
      throw unwrap(e);
    }
  }

  public String toJson(LayoutResult result) {
    return gson.toJson(checkNotNull(result, "result"), LayoutResult.class);
  }

  private <T> T read(Reader json, Class<T> type) throws IOException {
    checkNotNull(json, "json");
    T value;
    try {
      value = gson.fromJson(json, type);
    } catch (JsonIOException e) {
      throw unwrap(e);
    }
    if (value == null) {
      throw new JsonParseException("Empty document");
    }
    return value;
  }

  private static IOException unwrap(JsonIOException e) {
    Throwable cause = e.getCause();
    if (cause instanceof IOException) {
      return (IOException) cause;
    }
    throw e;
  }

  private static JsonObject asObject(JsonElement json, String what) {
    if (!json.isJsonObject()) {
      throw new JsonParseException(what + " must be an object: " + json);
    }
    return json.getAsJsonObject();
  }

  private static JsonArray arrayMember(JsonObject json, String name) {
    JsonElement member = json.get(name);
    if (member == null || member.isJsonNull()) {
      return new JsonArray();
    }
    if (!member.isJsonArray()) {
      throw new JsonParseException("'" + name + "' must be an array");
    }
    return member.getAsJsonArray();
  }

  @Nullable
  private static String stringMember(JsonObject json, String name) {
    JsonElement member = json.get(name);
    if (member == null || !member.isJsonPrimitive()) {
      return null;
    }
    return member.getAsString();
  }

  private static Map<String, Object> attributes(
      JsonObject json, ImmutableSet<String> reserved, JsonDeserializationContext context) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    for (Map.Entry<String, JsonElement> member : json.entrySet()) {
      if (!reserved.contains(member.getKey()) && !member.getValue().isJsonNull()) {
        attributes.put(member.getKey(), context.deserialize(member.getValue(), Object.class));
      }
    }
    return attributes;
  }

  private static final class GraphDataDeserializer implements JsonDeserializer<GraphData> {
    @Override
    public GraphData deserialize(
        JsonElement json, Type typeOfT, JsonDeserializationContext context) {
      JsonObject graph = asObject(json, "Graph");

      List<GraphNode> nodes = new ArrayList<>();
      for (JsonElement element : arrayMember(graph, "nodes")) {
        nodes.add(node(asObject(element, "Node"), context));
      }

      List<GraphEdge> edges = new ArrayList<>();
      for (JsonElement element : arrayMember(graph, "edges")) {
        JsonObject edge = asObject(element, "Edge");
        String id = stringMember(edge, "id");
        EdgeEndpoint source = endpoint(edge.get("source"), context);
        EdgeEndpoint target = endpoint(edge.get("target"), context);
        if (id == null || source == null || target == null) {
          logger.debug("Skipping incomplete edge {}", edge);
          continue;
        }
        edges.add(GraphEdge.of(id, source, target, attributes(edge, EDGE_MEMBERS, context)));
      }
      return GraphData.of(nodes, edges);
    }

    private static GraphNode node(JsonObject node, JsonDeserializationContext context) {
      String id = stringMember(node, "id");
      if (id == null) {
        throw new JsonParseException("Node without id: " + node);
      }
      return GraphNode.of(id, attributes(node, NODE_MEMBERS, context));
    }

    @Nullable
    private static EdgeEndpoint endpoint(
        @Nullable JsonElement json, JsonDeserializationContext context) {
      if (json == null || json.isJsonNull()) {
        return null;
      }
      if (json.isJsonPrimitive()) {
        return EdgeEndpoint.of(json.getAsString());
      }
      if (json.isJsonObject() && stringMember(json.getAsJsonObject(), "id") != null) {
        return EdgeEndpoint.of(node(json.getAsJsonObject(), context));
      }
      return null;
    }
  }

  private static final class LayoutOptionsDeserializer implements JsonDeserializer<LayoutOptions> {
    @Override
    public LayoutOptions deserialize(
        JsonElement json, Type typeOfT, JsonDeserializationContext context) {
      JsonObject options = asObject(json, "Options");
      try {
        String preset = stringMember(options, "preset");
        LayoutOptions.Builder builder =
            preset == null ? LayoutOptions.builder() : LayoutPreset.forId(preset).toBuilder();
        for (Map.Entry<String, JsonElement> member : options.entrySet()) {
          apply(builder, member.getKey(), member.getValue());
        }
        return builder.build();
      } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
        throw new JsonParseException(e.getMessage(), e);
      }
    }

    private static void apply(LayoutOptions.Builder builder, String name, JsonElement value) {
      switch (name) {
        case "preset":
          break;
        case "direction":
          builder.direction(LayoutDirection.forId(value.getAsString()));
          break;
        case "levelSeparation":
          builder.levelSeparation(value.getAsDouble());
          break;
        case "nodeSeparation":
          builder.nodeSeparation(value.getAsDouble());
          break;
        case "subtreeSeparation":
          builder.subtreeSeparation(value.getAsDouble());
          break;
        case "rootNodes":
          List<String> rootNodes = new ArrayList<>();
          for (JsonElement root : value.getAsJsonArray()) {
            rootNodes.add(root.getAsString());
          }
          builder.rootNodes(rootNodes);
          break;
        case "rankingAlgorithm":
          builder.rankingAlgorithm(RankingAlgorithm.forId(value.getAsString()));
          break;
        case "crossingMinimization":
          builder.crossingMinimization(CrossingMinimization.forId(value.getAsString()));
          break;
        case "coordinateAssignment":
          builder.coordinateAssignment(CoordinateAssignment.forId(value.getAsString()));
          break;
        case "crossingIterations":
          builder.crossingIterations(value.getAsInt());
          break;
        case "tightTreeIterations":
          builder.tightTreeIterations(value.getAsInt());
          break;
        case "alignmentIterations":
          builder.alignmentIterations(value.getAsInt());
          break;
        case "alignToGrid":
          builder.alignToGrid(value.getAsBoolean());
          break;
        case "gridSize":
          builder.gridSize(value.getAsDouble());
          break;
        case "compact":
          builder.compact(value.getAsBoolean());
          break;
        case "margin":
          builder.margin(value.getAsDouble());
          break;
        default:
          throw new JsonParseException("Unknown layout option: " + name);
      }
    }
  }

  private static final class LayoutResultSerializer implements JsonSerializer<LayoutResult> {
    @Override
    public JsonElement serialize(
        LayoutResult src, Type typeOfSrc, JsonSerializationContext context) {
      JsonObject positions = new JsonObject();
      for (Map.Entry<String, Point> position : src.positions().entrySet()) {
        positions.add(position.getKey(), context.serialize(position.getValue(), Point.class));
      }
      JsonArray edges = new JsonArray();
      for (RoutedEdge edge : src.edges()) {
        edges.add(context.serialize(edge, RoutedEdge.class));
      }

      JsonObject json = new JsonObject();
      json.add("positions", positions);
      json.add("edges", edges);
      json.add("bounds", context.serialize(src.bounds(), Bounds.class));
      json.add("stats", context.serialize(src.stats(), LayoutStats.class));
      return json;
    }
  }

  private static final class RoutedEdgeSerializer implements JsonSerializer<RoutedEdge> {
    @Override
    public JsonElement serialize(RoutedEdge src, Type typeOfSrc, JsonSerializationContext context) {
      JsonObject json = new JsonObject();
      for (Map.Entry<String, Object> attribute : src.attributes().entrySet()) {
        json.add(attribute.getKey(), context.serialize(attribute.getValue()));
      }
      json.addProperty("id", src.id());
      json.addProperty("source", src.source());
      json.addProperty("target", src.target());
      json.addProperty("reversed", src.reversed());
      JsonArray dummyNodes = new JsonArray();
      src.dummyNodes().forEach(dummyNodes::add);
      json.add("dummyNodes", dummyNodes);
      JsonArray controlPoints = new JsonArray();
      for (Point point : src.controlPoints()) {
        controlPoints.add(context.serialize(point, Point.class));
      }
      json.add("controlPoints", controlPoints);
      return json;
    }
  }

  private static final class PointSerializer implements JsonSerializer<Point> {
    @Override
    public JsonElement serialize(Point src, Type typeOfSrc, JsonSerializationContext context) {
      JsonObject json = new JsonObject();
      json.add("x", new JsonPrimitive(src.x()));
      json.add("y", new JsonPrimitive(src.y()));
      return json;
    }
  }

  private static final class BoundsSerializer implements JsonSerializer<Bounds> {
    @Override
    public JsonElement serialize(Bounds src, Type typeOfSrc, JsonSerializationContext context) {
      JsonObject json = new JsonObject();
      json.addProperty("minX", src.minX());
      json.addProperty("minY", src.minY());
      json.addProperty("maxX", src.maxX());
      json.addProperty("maxY", src.maxY());
      json.addProperty("width", src.width());
      json.addProperty("height", src.height());
      return json;
    }
  }

  private static final class LayoutStatsSerializer implements JsonSerializer<LayoutStats> {
    @Override
    public JsonElement serialize(
        LayoutStats src, Type typeOfSrc, JsonSerializationContext context) {
      JsonObject json = new JsonObject();
      json.addProperty("crossings", src.crossings());
      json.addProperty("dummyNodes", src.dummyNodes());
      json.addProperty("reversedEdges", src.reversedEdges());
      json.addProperty("totalEdgeLength", src.totalEdgeLength());
      return json;
    }
  }
}
