package co.fanki.dirrollup.rollup.application;

/**
 * An input record that was rejected and left out of the rollup.
 *
 * @param index the position of the record in the input
 * @param path the record path, null if it had none
 * @param reason why the record was rejected
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RecordError(int index, String path, String reason) {}
