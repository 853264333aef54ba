package com.kriskowal.tagyaml;

import java.util.ArrayList;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Adds {@code !unsafe}, {@code !vault} and the deprecated {@code !vault-encrypted} to the
 * standard tags of {@link TaggingConstructor}.
 *
 * <p>Strings anywhere below an {@code !unsafe} node are never marked {@link TrustedAsTemplate},
 * however deeply the unsafe nodes nest.
 */
public class CustomTagConstructor extends TaggingConstructor {

  public static final Tag UNSAFE = new Tag("!unsafe");
  public static final Tag VAULT = new Tag("!vault");
  public static final Tag VAULT_ENCRYPTED = new Tag("!vault-encrypted");

  private final Resolver resolver;

  public CustomTagConstructor(
      LoaderOptions options,
      LoaderSettings settings,
      Origin baseOrigin,
      boolean trustedAsTemplate,
      WarningSink warnings,
      Resolver resolver) {
    super(options, settings, baseOrigin, trustedAsTemplate, warnings);
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  @Override
  protected void registerTagHandlers() {
    super.registerTagHandlers();
    yamlConstructors.put(UNSAFE, new ConstructUnsafe());
    yamlConstructors.put(VAULT, new ConstructVault("!vault", false));
    yamlConstructors.put(VAULT_ENCRYPTED, new ConstructVault("!vault-encrypted", true));
  }

  /**
   * Construct the node as if its explicit tag were absent. The node is copied, never retagged in
   * place, since SnakeYAML caches constructed values by node.
   */
  protected Object resolveAndConstruct(Node node) {
    return constructObject(withImplicitTag(node));
  }

  private Node withImplicitTag(Node node) {
    switch (node.getNodeId()) {
      case scalar:
        ScalarNode scalar = (ScalarNode) node;
        return new ScalarNode(
            resolver.resolve(NodeId.scalar, scalar.getValue(), true),
            scalar.getValue(),
            scalar.getStartMark(),
            scalar.getEndMark(),
            scalar.getScalarStyle());
      case sequence:
        SequenceNode sequence = (SequenceNode) node;
        return new SequenceNode(
            resolver.resolve(NodeId.sequence, null, true),
            true,
            new ArrayList<>(sequence.getValue()),
            sequence.getStartMark(),
            sequence.getEndMark(),
            sequence.getFlowStyle());
      case mapping:
        MappingNode mapping = (MappingNode) node;
        MappingNode copy =
            new MappingNode(
                resolver.resolve(NodeId.mapping, null, true),
                true,
                new ArrayList<>(mapping.getValue()),
                mapping.getStartMark(),
                mapping.getEndMark(),
                mapping.getFlowStyle());
        copy.setMerged(mapping.isMerged());
        return copy;
      default:
        throw new YAMLException("Unexpected node type " + node.getNodeId());
    }
  }

  private class ConstructUnsafe extends AbstractConstruct {
    @Override
    public Object construct(Node node) {
      try (TrustTracker.Scope scope = trust.enter()) {
        return resolveAndConstruct(node);
      }
    }
  }

  private class ConstructVault extends AbstractConstruct {
    private final String tagName;
    private final boolean deprecated;

    ConstructVault(String tagName, boolean deprecated) {
      this.tagName = tagName;
      this.deprecated = deprecated;
    }

    @Override
    public Object construct(Node node) {
      if (deprecated) {
        warnings.deprecated(
            "Use of the YAML `" + tagName + "` tag is deprecated.",
            DEPRECATION_VERSION,
            originOf(node),
            "Use the `!vault` tag instead.");
      }

      Object value = resolveAndConstruct(node);
      Object raw = DataTags.untag(value);
      if (!(raw instanceof String)) {
        throw new StructuralConstructionException(
            "The `" + tagName + "` tag requires a string value.", node.getStartMark());
      }

      String ciphertext = (String) raw;
      return DataTags.tagCopy(value, new EncryptedString(ciphertext))
          .withTags(new VaultedValue(ciphertext));
    }
  }
}
