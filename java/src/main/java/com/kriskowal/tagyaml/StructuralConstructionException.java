package com.kriskowal.tagyaml;

import org.yaml.snakeyaml.constructor.ConstructorException;
import org.yaml.snakeyaml.error.Mark;

/**
 * A construction failure whose cause is fully understood, such as a duplicate key under {@link
 * DuplicateKeyPolicy#ERROR} or a {@code !vault} tag on a non-string. Its problem text is shown
 * as is; no diagnostic guessing applies.
 */
public class StructuralConstructionException extends ConstructorException {

  public StructuralConstructionException(String problem, Mark problemMark) {
    super(null, null, problem, problemMark);
  }
}
