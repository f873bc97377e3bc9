package com.tfltimetable.backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tfltimetable.backend.client.TflApi;
import com.tfltimetable.backend.config.TflProperties;
import com.tfltimetable.backend.exception.UpstreamUnavailableException;
import com.tfltimetable.backend.model.LineAttachment;
import com.tfltimetable.backend.model.tfl.SearchResponse;
import com.tfltimetable.backend.model.tfl.StopPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StopResolverTest {

    @Mock
    private TflApi tflApiClient;

    private StopResolver stopResolver;

    @BeforeEach
    void setUp() {
        stopResolver = new StopResolver(tflApiClient, properties(16));
    }

    private static TflProperties properties(int maxHubDepth) {
        return new TflProperties("https://api.tfl.gov.uk", "", "test-agent", 5, "HUB", "940G",
                List.of("HUBAMR", "HUBRMD"), maxHubDepth);
    }

    private static SearchResponse search(String... ids) {
        List<SearchResponse.SearchMatch> matches = new ArrayList<>();
        for (String id : ids) {
            matches.add(SearchResponse.SearchMatch.builder().id(id).name(id).build());
        }
        return SearchResponse.builder().total(ids.length).matches(matches).build();
    }

    private static StopPoint node(String id, StopPoint... children) {
        return StopPoint.builder().id(id).naptanId(id).children(Arrays.asList(children)).build();
    }

    private static StopPoint platform(String id, String... lineIds) {
        List<StopPoint.Identifier> lines = new ArrayList<>();
        for (String lineId : lineIds) {
            lines.add(StopPoint.Identifier.builder().id(lineId).name(lineId).build());
        }
        return StopPoint.builder().id(id).naptanId(id).lines(lines).children(new ArrayList<>()).build();
    }

    private static List<String> platformIds(List<LineAttachment> attachments) {
        return attachments.stream().map(LineAttachment::getPlatformId).collect(Collectors.toList());
    }

    @Test
    void testResolve_RichmondHubExpandsToUndergroundPlatform() throws Exception {
        SearchResponse searchPayload = TimetableFixtures.load("richmond_tube_stoppoint_search.json", SearchResponse.class);
        List<StopPoint> hubPayload = TimetableFixtures.load("HUBRMD_stoppoint_get.json",
                new TypeReference<List<StopPoint>>() {
                });
        List<StopPoint> platformPayload = TimetableFixtures.load("940GZZLURMD_stoppoint_get.json",
                new TypeReference<List<StopPoint>>() {
                });

        when(tflApiClient.searchStopPoints("Richmond", "tube")).thenReturn(searchPayload);
        when(tflApiClient.getStopPoints(List.of("HUBRMD", "HUBAMR"))).thenReturn(hubPayload);
        when(tflApiClient.getStopPoints(List.of("940GZZLURMD", "HUBAMR"))).thenReturn(platformPayload);

        List<LineAttachment> result = stopResolver.resolve("Richmond", "tube");

        // the padding stop and its metropolitan line never show up
        assertEquals(List.of(new LineAttachment("district", "940GZZLURMD")), result);
    }

    @Test
    void testResolve_NestedHubsNeverAppearInOutput() {
        StopPoint hub = node("HUB1",
                node("940GZZLURMD"),
                node("HUBXYZ",
                        node("940GZZLUKWG"),
                        node("HUBDEEP", node("940GZZLUGBY")),
                        node("910GKEWGRDN")));

        when(tflApiClient.searchStopPoints("Richmond", "tube")).thenReturn(search("HUB1", "940GZZLUTNG"));
        when(tflApiClient.getStopPoints(List.of("HUB1", "940GZZLUTNG")))
                .thenReturn(List.of(hub, platform("940GZZLUTNG")));
        when(tflApiClient.getStopPoints(List.of("940GZZLURMD", "940GZZLUKWG", "940GZZLUGBY", "940GZZLUTNG")))
                .thenReturn(List.of(
                        platform("940GZZLURMD", "district"),
                        platform("940GZZLUKWG", "district"),
                        platform("940GZZLUGBY", "district"),
                        platform("940GZZLUTNG", "district", "piccadilly")));

        List<LineAttachment> result = stopResolver.resolve("Richmond", "tube");

        assertEquals(List.of("940GZZLURMD", "940GZZLUKWG", "940GZZLUGBY", "940GZZLUTNG", "940GZZLUTNG"),
                platformIds(result));
        assertEquals("piccadilly", result.get(4).getLineId());
        assertTrue(result.stream().noneMatch(a -> a.getPlatformId().startsWith("HUB")));
    }

    @Test
    void testResolve_SingleCandidateEqualToFirstPaddingUsesNextPadding() {
        when(tflApiClient.searchStopPoints("Amersham", "tube")).thenReturn(search("HUBAMR"));
        when(tflApiClient.getStopPoints(List.of("HUBAMR", "HUBRMD")))
                .thenReturn(List.of(node("HUBAMR", node("940GZZLUAMS")), node("HUBRMD", node("940GZZLURMD"))));
        when(tflApiClient.getStopPoints(List.of("940GZZLUAMS", "HUBAMR")))
                .thenReturn(List.of(platform("940GZZLUAMS", "metropolitan"), platform("HUBAMR", "chiltern")));

        List<LineAttachment> result = stopResolver.resolve("Amersham", "tube");

        assertEquals(List.of(new LineAttachment("metropolitan", "940GZZLUAMS")), result);
    }

    @Test
    void testResolve_DuplicatePlatformsArePreserved() {
        StopPoint hub = node("HUB1", node("940GZZLURMD"), node("HUB2", node("940GZZLURMD")));
        when(tflApiClient.searchStopPoints("Richmond", "tube")).thenReturn(search("HUB1", "HUB3"));
        when(tflApiClient.getStopPoints(List.of("HUB1", "HUB3"))).thenReturn(List.of(hub, node("HUB3")));
        when(tflApiClient.getStopPoints(List.of("940GZZLURMD", "940GZZLURMD")))
                .thenReturn(List.of(platform("940GZZLURMD", "district"), platform("940GZZLURMD", "district")));

        List<LineAttachment> result = stopResolver.resolve("Richmond", "tube");

        assertEquals(2, result.size());
        assertEquals(result.get(0), result.get(1));
    }

    @Test
    void testResolve_TreeDeeperThanLimitIsCutOff() {
        stopResolver = new StopResolver(tflApiClient, properties(2));
        StopPoint hub = node("HUB1",
                node("940GAAAAAAA"),
                node("HUB2",
                        node("940GBBBBBBB"),
                        node("HUB3", node("940GCCCCCCC"))));

        when(tflApiClient.searchStopPoints("Deep", "tube")).thenReturn(search("HUB1"));
        when(tflApiClient.getStopPoints(List.of("HUB1", "HUBAMR"))).thenReturn(List.of(hub));
        when(tflApiClient.getStopPoints(List.of("940GAAAAAAA", "940GBBBBBBB")))
                .thenReturn(List.of(platform("940GAAAAAAA", "x"), platform("940GBBBBBBB", "y")));

        List<LineAttachment> result = stopResolver.resolve("Deep", "tube");

        assertEquals(List.of("940GAAAAAAA", "940GBBBBBBB"), platformIds(result));
    }

    @Test
    void testResolve_HubWithoutChildrenIsTolerated() {
        StopPoint bareHub = StopPoint.builder().id("HUB1").build();
        when(tflApiClient.searchStopPoints("Nowhere", "tube")).thenReturn(search("HUB1"));
        when(tflApiClient.getStopPoints(List.of("HUB1", "HUBAMR"))).thenReturn(List.of(bareHub));

        assertTrue(stopResolver.resolve("Nowhere", "tube").isEmpty());
        verify(tflApiClient, times(1)).getStopPoints(anyList());
    }

    @Test
    void testResolve_NoMatchesReturnsEmptyWithoutDetailsCall() {
        when(tflApiClient.searchStopPoints("Atlantis", "tube")).thenReturn(search());

        assertTrue(stopResolver.resolve("Atlantis", "tube").isEmpty());
        verify(tflApiClient, never()).getStopPoints(any());
    }

    @Test
    void testResolve_UpstreamFailurePropagates() {
        when(tflApiClient.searchStopPoints("Richmond", "tube")).thenReturn(search("HUBRMD"));
        when(tflApiClient.getStopPoints(anyList())).thenThrow(new UpstreamUnavailableException("TfL returned 503"));

        assertThrows(UpstreamUnavailableException.class, () -> stopResolver.resolve("Richmond", "tube"));
    }

    @Test
    void testResolvePlatformId_PlatformUnchanged() {
        assertEquals("940GZZLURMD", stopResolver.resolvePlatformId("940GZZLURMD"));
        verifyNoInteractions(tflApiClient);
    }

    @Test
    void testResolvePlatformId_HubResolvesToFirstDeepPlatform() throws Exception {
        List<StopPoint> hubPayload = TimetableFixtures.load("HUBRMD_stoppoint_get.json",
                new TypeReference<List<StopPoint>>() {
                });
        when(tflApiClient.getStopPoints(List.of("HUBRMD", "HUBAMR"))).thenReturn(hubPayload);

        assertEquals("940GZZLURMD", stopResolver.resolvePlatformId("HUBRMD"));
    }

    @Test
    void testResolvePlatformId_HubWithoutPlatformsResolvesToItself() {
        when(tflApiClient.getStopPoints(List.of("HUBXYZ", "HUBAMR")))
                .thenReturn(List.of(node("HUBXYZ", node("910GXYZ"))));

        assertEquals("HUBXYZ", stopResolver.resolvePlatformId("HUBXYZ"));
    }
}
