package dev.nuclr.rrdgraph.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ResponseParser}.
 * Tests run without any external process, purely against the static parser.
 */
class ResponseParserTest {

    @Test
    void okLineTerminatesResponse() {
        assertTrue(ResponseParser.isTerminator("OK u:0,01 s:0,00 r:0,02"));
        assertTrue(ResponseParser.isTerminator("OK"));
        assertTrue(ResponseParser.isTerminator("ERROR: opening 'cpu.rrd': No such file or directory"));
    }

    @Test
    void ordinaryLinesDoNotTerminate() {
        assertFalse(ResponseParser.isTerminator("497x148"));
        assertFalse(ResponseParser.isTerminator("OKAY then"));
        assertFalse(ResponseParser.isTerminator(""));
        assertFalse(ResponseParser.isTerminator("  1.2e+03"));
    }

    @Test
    void graphAnswerCarriesPixelSize() {
        RenderResponse r = ResponseParser.parse(List.of("497x148", "OK u:0,01 s:0,00 r:0,02"));

        assertTrue(r.success());
        assertEquals(new PixelSize(497, 148), r.pixelSize());
        assertEquals("497x148", r.output());
        assertEquals("", r.error());
    }

    @Test
    void zeroSizeIsNotReported() {
        RenderResponse r = ResponseParser.parse(List.of("0x0", "OK u:0,00 s:0,00 r:0,00"));

        assertTrue(r.success());
        assertTrue(r.reportedSize().isEmpty(), "0x0 must not be taken as a pixel size");
    }

    @Test
    void bareOkHasNoSize() {
        RenderResponse r = ResponseParser.parse(List.of("OK u:0,00 s:0,00 r:0,00"));

        assertTrue(r.success());
        assertNull(r.pixelSize());
        assertEquals("", r.output());
    }

    @Test
    void errorLineBecomesFailureMessage() {
        RenderResponse r = ResponseParser.parse(List.of("ERROR: opening 'cpu.rrd': No such file or directory"));

        assertFalse(r.success());
        assertEquals("opening 'cpu.rrd': No such file or directory", r.error());
    }

    @Test
    void emptyErrorGetsGenericMessage() {
        RenderResponse r = ResponseParser.parse(List.of("ERROR:"));

        assertFalse(r.success());
        assertFalse(r.error().isBlank());
    }

    @Test
    void emptyResponseIsFailure() {
        assertFalse(ResponseParser.parse(List.of()).success());
    }

    @Test
    void unterminatedResponseIsFailure() {
        RenderResponse r = ResponseParser.parse(List.of("497x148"));

        assertFalse(r.success());
        assertTrue(r.error().contains("Unterminated"));
    }
}
