package co.fanki.dirrollup.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects of the rollup model.
 *
 * <p>Value objects are immutable and compared by their attributes. The
 * rollup relies on this: identical input records must produce equal
 * reports, so every value that ends up in a report is a value object.</p>
 *
 * <p>Implementations must:</p>
 * <ul>
 *   <li>Be immutable</li>
 *   <li>Override equals() and hashCode() based on all attributes</li>
 *   <li>Be self-validating (validate in constructor)</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
