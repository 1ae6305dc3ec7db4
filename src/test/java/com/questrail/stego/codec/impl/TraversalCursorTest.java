package com.questrail.stego.codec.impl;

import com.questrail.stego.config.StartPosition;
import com.questrail.stego.config.StegoConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TraversalCursorTest
 * -----------------------------------------------------------------------------
 * Visitation order over a 4x3 image (12 pixels) unless noted otherwise.
 */
final class TraversalCursorTest
{
    private static final int WIDTH = 4;
    private static final int HEIGHT = 3;

    @Test
    void defaultConfigVisitsEveryPixelInRowMajorOrder()
    {
        TraversalCursor cursor = TraversalCursor.over(StegoConfig.defaults(), WIDTH, HEIGHT);

        List<Long> indices = drain(cursor);
        assertEquals(List.of(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L, 11L), indices);
        assertFalse(cursor.hasNext());
    }

    @Test
    void indexMapsToRowMajorCoordinates()
    {
        StegoConfig config = StegoConfig.builder().withPixelOffset(5).build();
        TraversalCursor.PixelAddress first = TraversalCursor.over(config, WIDTH, HEIGHT).next();

        assertEquals(5, first.index());
        assertEquals(1, first.x());
        assertEquals(1, first.y());
        assertEquals(0, first.pass());
    }

    @Test
    void offsetAndStrideSelectEveryNthPixel()
    {
        StegoConfig config = StegoConfig.builder().withPixelOffset(2).withPixelStride(3).build();

        assertEquals(List.of(2L, 5L, 8L, 11L), drain(TraversalCursor.over(config, WIDTH, HEIGHT)));
        assertEquals(4, TraversalCursor.singlePassVisits(config, WIDTH, HEIGHT));
    }

    @Test
    void startPositionsContributeBaseOffset()
    {
        assertEquals(0, firstIndex(StartPosition.Anchor.TOP_LEFT));
        assertEquals(4, firstIndex(StartPosition.Anchor.TOP_RIGHT));
        assertEquals(3, firstIndex(StartPosition.Anchor.BOTTOM_LEFT));
        assertEquals(7, firstIndex(StartPosition.Anchor.BOTTOM_RIGHT));
        assertEquals(3, firstIndex(StartPosition.Anchor.CENTER));
        assertEquals(6, firstIndex(StartPosition.at(2, 3)));
    }

    @Test
    void startPositionAndOffsetAreAdded()
    {
        StegoConfig config = StegoConfig.builder()
                .withStartPosition(StartPosition.Anchor.TOP_RIGHT)
                .withPixelOffset(2)
                .build();

        assertEquals(List.of(6L, 7L, 8L, 9L, 10L, 11L), drain(TraversalCursor.over(config, WIDTH, HEIGHT)));
    }

    @Test
    void withoutSpreadCursorStopsAfterFirstPass()
    {
        StegoConfig config = StegoConfig.builder().withPixelOffset(10).build();
        TraversalCursor cursor = TraversalCursor.over(config, WIDTH, HEIGHT);

        assertEquals(List.of(10L, 11L), drain(cursor));
        assertEquals(2, cursor.maxVisits());
        assertThrows(NoSuchElementException.class, cursor::next);
    }

    @Test
    void spreadWrapsToIndexZeroWithoutReapplyingSkip()
    {
        StegoConfig config = StegoConfig.builder().withPixelOffset(10).withSpread(true).build();
        TraversalCursor cursor = TraversalCursor.over(config, WIDTH, HEIGHT);

        List<TraversalCursor.PixelAddress> visits = new ArrayList<>();
        while (cursor.hasNext()) {
            visits.add(cursor.next());
        }

        assertEquals(12, visits.size());
        assertEquals(10, visits.get(0).index());
        assertEquals(11, visits.get(1).index());
        assertEquals(0, visits.get(2).index());
        assertEquals(1, visits.get(2).pass());
        assertEquals(9, visits.get(11).index());
    }

    @Test
    void spreadNeverExceedsPixelCount()
    {
        StegoConfig config = StegoConfig.builder().withPixelStride(5).withSpread(true).build();
        TraversalCursor cursor = TraversalCursor.over(config, WIDTH, HEIGHT);

        List<Long> indices = drain(cursor);
        assertEquals(List.of(0L, 5L, 10L, 1L, 6L, 11L, 2L, 7L, 3L, 8L, 4L, 9L), indices);
        assertEquals(4, cursor.pass());
    }

    @Test
    void stridedSpreadVisitsEveryPixelExactlyOnce()
    {
        StegoConfig config = StegoConfig.builder().withPixelStride(2).withSpread(true).build();
        TraversalCursor cursor = TraversalCursor.over(config, WIDTH, HEIGHT);

        List<Long> indices = drain(cursor);
        assertEquals(List.of(0L, 2L, 4L, 6L, 8L, 10L, 1L, 3L, 5L, 7L, 9L, 11L), indices);
        assertEquals(12, new HashSet<>(indices).size());
        assertEquals(1, cursor.pass());
    }

    @Test
    void stridedSpreadWrapStopsShortOfStartInItsOwnClass()
    {
        StegoConfig config = StegoConfig.builder()
                .withPixelOffset(4)
                .withPixelStride(2)
                .withSpread(true)
                .build();

        assertEquals(List.of(4L, 6L, 8L, 10L, 0L, 2L, 1L, 3L, 5L, 7L, 9L, 11L),
                drain(TraversalCursor.over(config, WIDTH, HEIGHT)));
    }

    @Test
    void startBeyondImageYieldsNothingWithoutSpread()
    {
        StegoConfig config = StegoConfig.builder().withPixelOffset(50).build();
        TraversalCursor cursor = TraversalCursor.over(config, WIDTH, HEIGHT);

        assertFalse(cursor.hasNext());
        assertEquals(0, cursor.maxVisits());
    }

    @Test
    void startBeyondImageWrapsImmediatelyWithSpread()
    {
        StegoConfig config = StegoConfig.builder().withPixelOffset(50).withSpread(true).build();
        TraversalCursor cursor = TraversalCursor.over(config, WIDTH, HEIGHT);

        TraversalCursor.PixelAddress first = cursor.next();
        assertEquals(0, first.index());
        assertEquals(1, first.pass());
    }

    @Test
    void resetRestartsFromFirstVisit()
    {
        StegoConfig config = StegoConfig.builder().withPixelOffset(1).withPixelStride(4).build();
        TraversalCursor cursor = TraversalCursor.over(config, WIDTH, HEIGHT);

        List<Long> first = drain(cursor);
        cursor.reset();
        assertEquals(0, cursor.visited());
        assertEquals(first, drain(cursor));
    }

    @Test
    void rejectsEmptyImage()
    {
        assertThrows(IllegalArgumentException.class,
                () -> TraversalCursor.over(StegoConfig.defaults(), 0, 5));
    }

    private static long firstIndex(StartPosition position)
    {
        StegoConfig config = StegoConfig.builder().withStartPosition(position).build();
        return TraversalCursor.over(config, WIDTH, HEIGHT).next().index();
    }

    private static List<Long> drain(TraversalCursor cursor)
    {
        List<Long> out = new ArrayList<>();
        while (cursor.hasNext()) {
            out.add(cursor.next().index());
        }
        return out;
    }
}
