/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.storage.io.codec;

import ai.evacortex.pwscore.core.AnalysisResults;
import ai.evacortex.pwscore.core.AnalysisWarning;
import ai.evacortex.pwscore.core.CubeTestUtils;
import ai.evacortex.pwscore.core.exceptions.ContainerOverflowException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodecSupportTest {

    @Test
    void testSizeOfDoubles_doesNotWrapForLargeCubes() {
        // 2048 x 2048 pixels, 91 bands
        long count = 2048L * 2048L * 91L;

        assertEquals(4L + 3_053_453_312L, CodecSupport.sizeOfDoubles(count));
    }

    @Test
    void testCheckedCapacity_rejectsOversizedPayload() {
        long size = CodecSupport.sizeOfDoubles(2048L * 2048L * 91L);

        ContainerOverflowException e = assertThrows(ContainerOverflowException.class,
                () -> CodecSupport.checkedCapacity(size, "Analysis results"));
        assertTrue(e.getMessage().contains(Long.toString(size)));
    }

    @Test
    void testCheckedCapacity_acceptsLimit() {
        assertEquals(1024, CodecSupport.checkedCapacity(1024L, "ROI"));
        assertEquals(CodecSupport.MAX_PAYLOAD_BYTES,
                CodecSupport.checkedCapacity(CodecSupport.MAX_PAYLOAD_BYTES, "ROI"));
        assertThrows(ContainerOverflowException.class,
                () -> CodecSupport.checkedCapacity(CodecSupport.MAX_PAYLOAD_BYTES + 1L, "ROI"));
    }

    @Test
    void testEstimateSize_matchesSerializedLength() {
        AnalysisResults results = CubeTestUtils.results("tag-size", CubeTestUtils.filledMap(3, 2, 0.4),
                CubeTestUtils.filledMap(3, 2, 0.05), null, CubeTestUtils.filledMap(3, 2, -1.5), null, null, null,
                List.of(new AnalysisWarning("short", "long message")));

        byte[] payload = AnalysisResultsCodec.serialize(results);

        assertEquals(payload.length, AnalysisResultsCodec.estimateSize(results));
    }
}
