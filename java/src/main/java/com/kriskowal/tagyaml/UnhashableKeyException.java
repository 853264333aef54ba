package com.kriskowal.tagyaml;

import org.yaml.snakeyaml.constructor.ConstructorException;
import org.yaml.snakeyaml.error.Mark;

/** A mapping key that is itself a collection. Usually an unquoted template such as {@code {{ x }}}. */
class UnhashableKeyException extends ConstructorException {

  UnhashableKeyException(Mark contextMark, Mark problemMark) {
    super("while constructing a mapping", contextMark, "found unhashable key", problemMark);
  }
}
