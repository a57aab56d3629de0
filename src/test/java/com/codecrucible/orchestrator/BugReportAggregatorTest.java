package com.codecrucible.orchestrator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BugReportAggregatorTest {

    @Test
    void testBlankAndAllClearReportsAreIgnored() {
        BugReportAggregator aggregator = new BugReportAggregator();

        assertFalse(aggregator.add(""));
        assertFalse(aggregator.add("   \n "));
        assertFalse(aggregator.add(null));
        assertFalse(aggregator.add("no issues"));
        assertFalse(aggregator.add("No bugs found."));

        assertTrue(aggregator.isBugFree());
        assertEquals("", aggregator.getAggregateReport());
    }

    @Test
    void testReportsAreJoinedWithBlankLine() {
        BugReportAggregator aggregator = new BugReportAggregator();

        aggregator.add("  Off-by-one in loop\nSeverity: Major ");
        aggregator.add("no issues");
        aggregator.add("Unused variable\nSeverity: Minor");

        assertFalse(aggregator.isBugFree());
        assertEquals("Off-by-one in loop\nSeverity: Major\n\nUnused variable\nSeverity: Minor",
                aggregator.getAggregateReport());
        assertEquals(2, aggregator.getReportCount());
        assertEquals(1, aggregator.getSeverityCounts().get(BugSeverity.MAJOR));
        assertEquals(1, aggregator.getSeverityCounts().get(BugSeverity.MINOR));
    }

    @Test
    void testReportMentioningIssuesIsKept() {
        BugReportAggregator aggregator = new BugReportAggregator();

        assertTrue(aggregator.add("No issues with style, but division by zero on line 3"));
        assertFalse(aggregator.isBugFree());
    }

    @Test
    void testSeverityParsing() {
        assertEquals(BugSeverity.MAJOR,   BugSeverity.parse("Severity: major"));
        assertEquals(BugSeverity.INFO,    BugSeverity.parse("note\nSEVERITY:Info"));
        assertEquals(BugSeverity.UNKNOWN, BugSeverity.parse("something is off"));
        assertEquals(BugSeverity.UNKNOWN, BugSeverity.parse(null));
    }
}
