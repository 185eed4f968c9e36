package com.binday.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

public class LabelSplitterTest {
    private final LabelSplitter splitter = new LabelSplitter();

    @Test
    void testSplitCompositeHeader() {
        assertEquals(List.of("Black Rubbish Bin", "Blue Cardboard Bag"),
            splitter.split("Black Rubbish Bin | Blue Cardboard Bag"));
    }

    @Test
    void testSingleLabelIsNormalized() {
        assertEquals(List.of("Green Recycling Box"), splitter.split("  Green   Recycling Box \n"));
    }

    @Test
    void testThreeWayHeaderKeepsOrder() {
        assertEquals(List.of("Garden Waste", "Food Waste", "Green Recycling Box"),
            splitter.split("Garden Waste |\u00A0Food Waste | Green Recycling Box"));
    }

    @Test
    void testBlankInput() {
        assertTrue(splitter.split(null).isEmpty());
        assertTrue(splitter.split("").isEmpty());
        assertTrue(splitter.split("   ").isEmpty());
    }

    @Test
    void testPipeWithoutSpacesIsNotASeparator() {
        assertEquals(List.of("Bag|Box"), splitter.split("Bag|Box"));
    }
}
