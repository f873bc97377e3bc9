package com.tfltimetable.backend.service;

import com.tfltimetable.backend.client.TflApi;
import com.tfltimetable.backend.config.TflProperties;
import com.tfltimetable.backend.model.LineAttachment;
import com.tfltimetable.backend.model.tfl.SearchResponse;
import com.tfltimetable.backend.model.tfl.StopPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Turns a free-text station name into the (line, platform) pairs a timetable can be
 * requested for, expanding hub stop points down to their platforms.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StopResolver {

    private final TflApi tflApiClient;
    private final TflProperties tflProperties;

    public List<LineAttachment> resolve(String stationName, String mode) {
        log.info("🔍 Resolving lines and platforms for '{}' (mode: {})", stationName, mode);

        // 1. Search
        SearchResponse search = tflApiClient.searchStopPoints(stationName, mode);
        List<String> candidateIds = new ArrayList<>();
        if (search != null && search.getMatches() != null) {
            for (SearchResponse.SearchMatch match : search.getMatches()) {
                candidateIds.add(match.getId());
            }
        }
        if (candidateIds.isEmpty()) {
            log.info("⚪ No stop points match '{}' (mode: {})", stationName, mode);
            return Collections.emptyList();
        }

        // 2. Expand hubs into platform ids
        List<String> platformIds = new ArrayList<>();
        for (StopPoint stopPoint : fetchStopPoints(candidateIds)) {
            if (tflProperties.isHub(stopPoint.getId())) {
                platformIds.addAll(collectPlatformIds(stopPoint));
            } else {
                platformIds.add(stopPoint.getId());
            }
        }
        if (platformIds.isEmpty()) {
            log.info("⚪ No platforms below the stop points matching '{}'", stationName);
            return Collections.emptyList();
        }

        // 3. Lines per platform
        List<LineAttachment> attachments = new ArrayList<>();
        for (StopPoint platform : fetchStopPoints(platformIds)) {
            if (tflProperties.isHub(platform.getId())) {
                log.debug("Skipping hub {} returned for a platform request", platform.getId());
                continue;
            }
            if (platform.getLines() == null) {
                continue;
            }
            String platformId = platform.getNaptanId() != null ? platform.getNaptanId() : platform.getId();
            for (StopPoint.Identifier line : platform.getLines()) {
                attachments.add(LineAttachment.builder()
                        .lineId(line.getId())
                        .platformId(platformId)
                        .build());
            }
        }

        log.info("✅ Resolved {} line/platform pairs for '{}'", attachments.size(), stationName);
        return attachments;
    }

    /**
     * Platform level id for a stop point: the id itself unless it is a hub, in which case the
     * first platform found below it. A hub without platforms resolves to itself.
     */
    public String resolvePlatformId(String stopPointId) {
        if (!tflProperties.isHub(stopPointId)) {
            return stopPointId;
        }

        List<StopPoint> fetched = fetchStopPoints(Collections.singletonList(stopPointId));
        if (fetched.isEmpty()) {
            return stopPointId;
        }

        // response order is not guaranteed
        StopPoint hub = fetched.get(0);
        for (StopPoint stopPoint : fetched) {
            if (stopPointId.equalsIgnoreCase(stopPoint.getId())) {
                hub = stopPoint;
                break;
            }
        }

        List<String> platformIds = collectPlatformIds(hub);
        if (platformIds.isEmpty()) {
            log.warn("⚠️ Hub {} has no platforms, using it as is", stopPointId);
            return stopPointId;
        }
        log.info("🔄 Resolved hub {} to platform {}", stopPointId, platformIds.get(0));
        return platformIds.get(0);
    }

    /**
     * Fetches stop points in one batch. A single id is padded with a distinct real stop id so
     * TfL answers with an array; the padding stop is dropped from the result.
     */
    private List<StopPoint> fetchStopPoints(List<String> ids) {
        List<String> requestIds = new ArrayList<>(ids);
        String padding = null;
        if (requestIds.size() == 1) {
            padding = paddingFor(requestIds.get(0));
            requestIds.add(padding);
        }

        List<StopPoint> response = tflApiClient.getStopPoints(requestIds);
        if (response == null) {
            return Collections.emptyList();
        }

        List<StopPoint> result = new ArrayList<>(response.size());
        for (StopPoint stopPoint : response) {
            if (padding != null && padding.equals(stopPoint.getId())) {
                continue;
            }
            result.add(stopPoint);
        }
        return result;
    }

    private String paddingFor(String id) {
        for (String candidate : tflProperties.getPaddingStopIds()) {
            if (!candidate.equals(id)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No padding stop id distinct from " + id + " is configured");
    }

    /**
     * Pre-order walk of the child tree collecting platform ids. Hubs and other groupings are
     * only descended into. Nodes deeper than the configured limit are skipped.
     */
    private List<String> collectPlatformIds(StopPoint root) {
        List<String> platformIds = new ArrayList<>();
        Deque<Node> pending = new ArrayDeque<>();
        pushChildren(pending, root, 1);

        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (node.depth > tflProperties.getMaxHubDepth()) {
                log.warn("⚠️ Stop point tree below {} deeper than {}, skipping {}", root.getId(),
                        tflProperties.getMaxHubDepth(), node.stopPoint.getId());
                continue;
            }
            if (tflProperties.isPlatform(node.stopPoint.getId())) {
                platformIds.add(node.stopPoint.getId());
            }
            pushChildren(pending, node.stopPoint, node.depth + 1);
        }
        return platformIds;
    }

    private void pushChildren(Deque<Node> pending, StopPoint parent, int depth) {
        List<StopPoint> children = parent.getChildren();
        if (children == null) {
            return;
        }
        // reversed so the first child is popped first
        for (int i = children.size() - 1; i >= 0; i--) {
            StopPoint child = children.get(i);
            if (child != null) {
                pending.push(new Node(child, depth));
            }
        }
    }

    private static final class Node {
        private final StopPoint stopPoint;
        private final int depth;

        private Node(StopPoint stopPoint, int depth) {
            this.stopPoint = stopPoint;
            this.depth = depth;
        }
    }
}
