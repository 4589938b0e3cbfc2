package co.fanki.dirrollup.rollup.application;

import co.fanki.dirrollup.rollup.domain.FileFlags;
import co.fanki.dirrollup.rollup.domain.FileRecord;
import co.fanki.dirrollup.rollup.domain.InvalidPathException;
import co.fanki.dirrollup.rollup.domain.RepositoryPath;
import co.fanki.dirrollup.shared.DomainException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads file records from collector JSON.
 *
 * <p>Accepts either {@code {"files": [...]}} or a bare array. Each entry
 * looks like:</p>
 * <pre>
 * {"path": "src/a.py", "language": "Python",
 *  "metrics": {"lines_code": 80},
 *  "flags": {"minified": false, "generated": false, "binary": false}}
 * </pre>
 *
 * <p>Flags are also read from {@code is_minified}, {@code is_generated}
 * and {@code is_binary} at the entry level, so the {@code files} of a
 * report can be read back. A malformed entry becomes a
 * {@link RecordError} and reading goes on with the next one.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FileRecordReader {

    /** Error code for a request body that holds no record list. */
    public static final String INVALID_INPUT = "INVALID_INPUT";

    private FileRecordReader() {
    }

    /**
     * Reads every record of the input.
     *
     * @param root the parsed JSON input
     * @return the accepted records, in input order, and the rejected ones
     * @throws DomainException if the input holds no record list
     */
    public static ReadResult read(final JsonNode root) {
        final JsonNode files = filesOf(root);

        final List<FileRecord> records = new ArrayList<>();
        final List<RecordError> errors = new ArrayList<>();
        final Set<RepositoryPath> seen = new HashSet<>();

        int index = 0;
        for (final JsonNode node : files) {
            final String rawPath = textOrNull(node, "path");
            try {
                final FileRecord fileRecord = parseRecord(node);
                if (seen.add(fileRecord.path())) {
                    records.add(fileRecord);
                } else {
                    errors.add(new RecordError(index, rawPath,
                            "duplicate path"));
                }
            } catch (final InvalidPathException e) {
                errors.add(new RecordError(index, rawPath, e.getReason()));
            } catch (final RejectedRecordException e) {
                errors.add(new RecordError(index, rawPath, e.getMessage()));
            }
            index++;
        }
        return new ReadResult(records, errors);
    }

    private static JsonNode filesOf(final JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new DomainException("Request body is empty",
                    INVALID_INPUT);
        }
        if (root.isArray()) {
            return root;
        }
        final JsonNode files = root.get("files");
        if (files == null || !files.isArray()) {
            throw new DomainException(
                    "Request body must hold a 'files' array", INVALID_INPUT);
        }
        return files;
    }

    private static FileRecord parseRecord(final JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new RejectedRecordException("record is not an object");
        }

        final JsonNode pathNode = node.get("path");
        if (pathNode == null || pathNode.isNull()) {
            throw new RejectedRecordException("path is missing");
        }
        if (!pathNode.isTextual()) {
            throw new RejectedRecordException("path is not a string");
        }

        final RepositoryPath path = RepositoryPath.of(pathNode.asText());
        return FileRecord.of(path.value(), textOrNull(node, "language"),
                parseMetrics(node.get("metrics")), parseFlags(node));
    }

    private static Map<String, Double> parseMetrics(final JsonNode node) {
        final Map<String, Double> metrics = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return metrics;
        }
        if (!node.isObject()) {
            throw new RejectedRecordException("metrics is not an object");
        }
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final JsonNode value = field.getValue();
            if (field.getKey().isBlank()) {
                throw new RejectedRecordException("metric name is blank");
            }
            if (value == null || !value.isNumber()) {
                throw new RejectedRecordException("metric " + field.getKey()
                        + " is not a number");
            }
            final double number = value.asDouble();
            if (!Double.isFinite(number)) {
                throw new RejectedRecordException("metric " + field.getKey()
                        + " is not a finite number");
            }
            metrics.put(field.getKey(), number);
        }
        return metrics;
    }

    private static FileFlags parseFlags(final JsonNode node) {
        final JsonNode flags = node.get("flags");
        if (flags != null && !flags.isNull() && !flags.isObject()) {
            throw new RejectedRecordException("flags is not an object");
        }
        return new FileFlags(
                flag(node, flags, "minified"),
                flag(node, flags, "generated"),
                flag(node, flags, "binary"));
    }

    private static boolean flag(final JsonNode node, final JsonNode flags,
            final String name) {
        if (flags != null && flags.isObject()) {
            final JsonNode value = flags.get(name);
            if (value != null && value.isBoolean()) {
                return value.asBoolean();
            }
        }
        final JsonNode value = node.get("is_" + name);
        return value != null && value.isBoolean() && value.asBoolean();
    }

    private static String textOrNull(final JsonNode node, final String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        final JsonNode fieldNode = node.get(field);
        return fieldNode != null && fieldNode.isTextual()
                ? fieldNode.asText() : null;
    }

    /**
     * Records accepted and rejected by a read.
     *
     * @param records the accepted records, in input order
     * @param errors the rejected records
     */
    public record ReadResult(List<FileRecord> records,
            List<RecordError> errors) {

        /** Copies the lists. */
        public ReadResult {
            records = List.copyOf(records);
            errors = List.copyOf(errors);
        }
    }

    /** Signals an entry that cannot become a record. */
    private static final class RejectedRecordException
            extends RuntimeException {

        private static final long serialVersionUID = 1L;

        RejectedRecordException(final String message) {
            super(message);
        }
    }

}
