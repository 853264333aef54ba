package com.kriskowal.tagyaml;

import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.Construct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

/**
 * Constructs the standard YAML tags as {@link Tagged} values carrying an {@link Origin}. Strings
 * are additionally marked {@link TrustedAsTemplate} when the source is trusted and no enclosing
 * {@code !unsafe} node suppresses it.
 *
 * <p>The standard handlers are installed by {@link #registerTagHandlers()}, which the loader
 * calls once after creating the constructor.
 */
public class TaggingConstructor extends SafeConstructor {

  private static final Logger log = LoggerFactory.getLogger(TaggingConstructor.class);

  static final String DEPRECATION_VERSION = "2.23";

  protected final TrustTracker trust = new TrustTracker();
  protected final WarningSink warnings;

  private final Origin baseOrigin;
  private final boolean trustedAsTemplate;
  private final DuplicateKeyPolicy duplicateKeyPolicy;

  // SnakeYAML's own handlers, captured before registerTagHandlers() replaces them
  private final Construct nullConstruct = yamlConstructors.get(Tag.NULL);
  private final Construct boolConstruct = yamlConstructors.get(Tag.BOOL);
  private final Construct intConstruct = yamlConstructors.get(Tag.INT);
  private final Construct floatConstruct = yamlConstructors.get(Tag.FLOAT);
  private final Construct binaryConstruct = yamlConstructors.get(Tag.BINARY);
  private final Construct timestampConstruct = yamlConstructors.get(Tag.TIMESTAMP);
  private final Construct pairsConstruct = yamlConstructors.get(Tag.PAIRS);
  private final Construct strConstruct = yamlConstructors.get(Tag.STR);

  public TaggingConstructor(
      LoaderOptions options,
      LoaderSettings settings,
      Origin baseOrigin,
      boolean trustedAsTemplate,
      WarningSink warnings) {
    super(options);
    this.baseOrigin = Objects.requireNonNull(baseOrigin, "baseOrigin");
    this.trustedAsTemplate = trustedAsTemplate;
    this.duplicateKeyPolicy = settings.getDuplicateKeyPolicy();
    this.warnings = Objects.requireNonNull(warnings, "warnings");
  }

  /**
   * Install the tag handlers. Subclasses adding tags must call {@code super.registerTagHandlers()}
   * first and then add or replace entries.
   */
  protected void registerTagHandlers() {
    yamlConstructors.put(Tag.NULL, new ConstructWithOrigin(nullConstruct));
    yamlConstructors.put(Tag.BOOL, new ConstructWithOrigin(boolConstruct));
    yamlConstructors.put(Tag.INT, new ConstructWithOrigin(intConstruct));
    yamlConstructors.put(Tag.FLOAT, new ConstructWithOrigin(floatConstruct));
    yamlConstructors.put(Tag.BINARY, new ConstructWithOrigin(binaryConstruct));
    yamlConstructors.put(Tag.TIMESTAMP, new ConstructWithOrigin(timestampConstruct));
    yamlConstructors.put(Tag.STR, new ConstructTaggedStr());
    yamlConstructors.put(Tag.SEQ, new ConstructTaggedSeq());
    yamlConstructors.put(Tag.SET, new ConstructTaggedSet());
    yamlConstructors.put(Tag.MAP, new ConstructTaggedMap());
    yamlConstructors.put(Tag.OMAP, new ConstructDeprecatedPairs("!!omap"));
    yamlConstructors.put(Tag.PAIRS, new ConstructDeprecatedPairs("!!pairs"));
  }

  /** Construct one composed document. A missing root node yields null at the base origin. */
  public Tagged<?> constructRoot(Node node) {
    if (node == null) {
      return Tagged.of(null, baseOrigin);
    }
    return (Tagged<?>) constructDocument(node);
  }

  public Origin getBaseOrigin() {
    return baseOrigin;
  }

  public boolean isTrustedAsTemplate() {
    return trustedAsTemplate;
  }

  /** Current number of enclosing {@code !unsafe} nodes. */
  public int getUnsafeDepth() {
    return trust.depth();
  }

  /** Position of a node, offset by the line of the base origin. */
  protected Origin originOf(Node node) {
    Mark mark = node != null ? node.getStartMark() : null;
    if (mark == null) {
      return baseOrigin;
    }
    return baseOrigin.withPosition(mark.getLine() + baseOrigin.getLineNum(), mark.getColumn() + 1);
  }

  /**
   * Repeated keys stay in the node so the mapping keeps a key at its first position with the last
   * value. Detection and reporting happen in {@link #checkKeys}.
   */
  @Override
  protected void processDuplicateKeys(MappingNode node) {}

  @Override
  protected void processDuplicateKeys(MappingNode node, boolean forceStringKeys) {}

  private void checkKeys(MappingNode node, List<NodeTuple> tuples) {
    Set<Tagged<?>> seen = new HashSet<>();
    for (NodeTuple tuple : tuples) {
      Node keyNode = tuple.getKeyNode();
      if (Tag.MERGE.equals(keyNode.getTag())) {
        continue;
      }
      // cached by SnakeYAML, so no key is constructed twice
      Object key = constructObject(keyNode);
      Object raw = DataTags.untag(key);
      if (raw instanceof Map || raw instanceof Collection) {
        throw new UnhashableKeyException(node.getStartMark(), keyNode.getStartMark());
      }
      if (!seen.add(key instanceof Tagged ? (Tagged<?>) key : Tagged.of(key))) {
        onDuplicateKey(keyNode, raw);
      }
    }
  }

  private void onDuplicateKey(Node keyNode, Object key) {
    String message = "Found duplicate mapping key " + describeKey(key) + ".";
    switch (duplicateKeyPolicy) {
      case ERROR:
        throw new StructuralConstructionException(message, keyNode.getStartMark());
      case WARN:
        warnings.warning(message, originOf(keyNode), "Using last defined value only.");
        break;
      default:
        log.debug("Ignoring duplicate mapping key {} at {}", describeKey(key), originOf(keyNode));
        break;
    }
  }

  private static String describeKey(Object key) {
    if (key instanceof String) {
      return "'" + key + "'";
    }
    return String.valueOf(key);
  }

  // ========================================================================
  // Handlers
  // ========================================================================

  /** Runs a SnakeYAML scalar construct and attaches the node's origin. */
  private class ConstructWithOrigin extends AbstractConstruct {
    private final Construct delegate;

    ConstructWithOrigin(Construct delegate) {
      this.delegate = delegate;
    }

    @Override
    public Object construct(Node node) {
      return Tagged.of(delegate.construct(node), originOf(node));
    }
  }

  private class ConstructTaggedStr extends AbstractConstruct {
    @Override
    public Object construct(Node node) {
      String value = (String) strConstruct.construct(node);
      Tagged<String> tagged = Tagged.of(value, originOf(node));
      // keys are trusted too; template engines rely on it
      if (trustedAsTemplate && !trust.isSuppressed()) {
        tagged = tagged.withTags(TrustedAsTemplate.INSTANCE);
      }
      return tagged;
    }
  }

  private class ConstructTaggedSeq implements Construct {
    @Override
    public Object construct(Node node) {
      SequenceNode seqNode = (SequenceNode) node;
      List<Object> list = createDefaultList(seqNode.getValue().size());
      if (!node.isTwoStepsConstruction()) {
        constructSequenceStep2(seqNode, list);
      }
      return Tagged.of(list, originOf(node));
    }

    @Override
    @SuppressWarnings("unchecked")
    public void construct2ndStep(Node node, Object data) {
      constructSequenceStep2((SequenceNode) node, (List<Object>) ((Tagged<?>) data).value());
    }
  }

  private class ConstructTaggedSet implements Construct {
    @Override
    public Object construct(Node node) {
      MappingNode mapNode = (MappingNode) node;
      if (node.isTwoStepsConstruction()) {
        return Tagged.of(createDefaultSet(mapNode.getValue().size()), originOf(node));
      }
      List<NodeTuple> tuples = new ArrayList<>(mapNode.getValue());
      Set<Object> set = constructSet(mapNode);
      checkKeys(mapNode, tuples);
      return Tagged.of(set, originOf(node));
    }

    @Override
    @SuppressWarnings("unchecked")
    public void construct2ndStep(Node node, Object data) {
      MappingNode mapNode = (MappingNode) node;
      List<NodeTuple> tuples = new ArrayList<>(mapNode.getValue());
      constructSet2ndStep(mapNode, (Set<Object>) ((Tagged<?>) data).value());
      checkKeys(mapNode, tuples);
    }
  }

  private class ConstructTaggedMap implements Construct {
    @Override
    public Object construct(Node node) {
      MappingNode mapNode = (MappingNode) node;
      if (node.isTwoStepsConstruction()) {
        return Tagged.of(createDefaultMap(mapNode.getValue().size()), originOf(node));
      }
      // merge and duplicate handling rewrite the node's tuples; check against the original ones
      List<NodeTuple> tuples = new ArrayList<>(mapNode.getValue());
      Map<Object, Object> mapping = constructMapping(mapNode);
      checkKeys(mapNode, tuples);
      return Tagged.of(mapping, originOf(node));
    }

    @Override
    @SuppressWarnings("unchecked")
    public void construct2ndStep(Node node, Object data) {
      MappingNode mapNode = (MappingNode) node;
      List<NodeTuple> tuples = new ArrayList<>(mapNode.getValue());
      constructMapping2ndStep(mapNode, (Map<Object, Object>) ((Tagged<?>) data).value());
      checkKeys(mapNode, tuples);
    }
  }

  /** {@code !!omap} and {@code !!pairs}: a list of single-entry pairs, each with its origin. */
  private class ConstructDeprecatedPairs extends AbstractConstruct {
    private final String tagName;

    ConstructDeprecatedPairs(String tagName) {
      this.tagName = tagName;
    }

    @Override
    public Object construct(Node node) {
      Origin origin = originOf(node);
      warnings.deprecated(
          "Use of the YAML `" + tagName + "` tag is deprecated.",
          DEPRECATION_VERSION,
          origin,
          "Use a standard mapping instead, as key order is always preserved.");

      List<?> pairs = (List<?>) pairsConstruct.construct(node);
      List<Node> items = ((SequenceNode) node).getValue();
      List<Tagged<?>> entries = new ArrayList<>(pairs.size());
      for (int i = 0; i < pairs.size(); i++) {
        Object[] pair = (Object[]) pairs.get(i);
        entries.add(
            Tagged.of(
                new AbstractMap.SimpleImmutableEntry<>(pair[0], pair[1]),
                originOf(items.get(i))));
      }
      return Tagged.of(entries, origin);
    }
  }
}
