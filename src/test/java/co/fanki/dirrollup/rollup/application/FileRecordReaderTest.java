package co.fanki.dirrollup.rollup.application;

import co.fanki.dirrollup.rollup.application.FileRecordReader.ReadResult;
import co.fanki.dirrollup.rollup.domain.FileFlags;
import co.fanki.dirrollup.rollup.domain.FileRecord;
import co.fanki.dirrollup.shared.DomainException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for FileRecordReader.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FileRecordReaderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void whenReading_givenWellFormedFiles_shouldReturnRecordsInOrder()
            throws Exception {
        final ReadResult result = FileRecordReader.read(json("""
                {"files": [
                  {"path": "src/b.py", "language": "Python",
                   "metrics": {"lines_code": 40, "complexity": 3},
                   "flags": {"minified": false, "generated": true,
                             "binary": false}},
                  {"path": "a.py", "metrics": {"lines_code": 80}}
                ]}
                """));

        assertTrue(result.errors().isEmpty());
        assertEquals(2, result.records().size());

        final FileRecord first = result.records().get(0);
        assertEquals("src/b.py", first.path().value());
        assertEquals("Python", first.language());
        assertEquals(40.0, first.metric("lines_code"));
        assertEquals(new FileFlags(false, true, false), first.flags());
        assertEquals(FileRecord.UNKNOWN_LANGUAGE,
                result.records().get(1).language());
    }

    @Test
    void whenReading_givenBareArray_shouldAcceptIt() throws Exception {
        final ReadResult result = FileRecordReader.read(json("""
                [{"path": "a.py", "metrics": {}}]
                """));

        assertEquals(1, result.records().size());
    }

    @Test
    void whenReading_givenReportFileFlags_shouldReadThemBack()
            throws Exception {
        final ReadResult result = FileRecordReader.read(json("""
                {"files": [{"path": "dist/app.min.js", "metrics": {},
                            "is_minified": true, "is_binary": false,
                            "comment_ratio": 0.1}]}
                """));

        assertEquals(new FileFlags(true, false, false),
                result.records().get(0).flags());
    }

    @Test
    void whenReading_givenMalformedEntries_shouldRejectEachAndKeepGoing()
            throws Exception {
        final ReadResult result = FileRecordReader.read(json("""
                {"files": [
                  {"path": "ok.py", "metrics": {"lines_code": 1}},
                  "not-an-object",
                  {"metrics": {"lines_code": 1}},
                  {"path": "/abs.py", "metrics": {}},
                  {"path": "bad.py", "metrics": {"lines_code": "many"}},
                  {"path": "ok.py", "metrics": {"lines_code": 2}},
                  {"path": "huge.py", "metrics": {"bytes": 1e400}},
                  {"path": "src/../x.py"},
                  {"path": "last.py", "metrics": [1, 2]}
                ]}
                """));

        assertEquals(1, result.records().size());
        assertEquals(8, result.errors().size());

        final RecordError notObject = result.errors().get(0);
        assertEquals(1, notObject.index());
        assertNull(notObject.path());
        assertEquals("record is not an object", notObject.reason());

        assertEquals("path is missing", result.errors().get(1).reason());
        assertEquals("path is absolute", result.errors().get(2).reason());
        assertEquals("metric lines_code is not a number",
                result.errors().get(3).reason());
        assertEquals("duplicate path", result.errors().get(4).reason());
        assertEquals(5, result.errors().get(4).index());
        assertEquals("metric bytes is not a finite number",
                result.errors().get(5).reason());
        assertEquals("parent directory segment",
                result.errors().get(6).reason());
        assertEquals("metrics is not an object",
                result.errors().get(7).reason());
    }

    @Test
    void whenReading_givenBodyWithoutFiles_shouldThrowException()
            throws Exception {
        final DomainException e = assertThrows(DomainException.class,
                () -> FileRecordReader.read(json("{\"records\": []}")));

        assertEquals(FileRecordReader.INVALID_INPUT, e.getErrorCode());
    }

    @Test
    void whenReading_givenNullBody_shouldThrowException() {
        assertThrows(DomainException.class,
                () -> FileRecordReader.read(null));
    }

    private static JsonNode json(final String content) throws Exception {
        return MAPPER.readTree(content);
    }

}
