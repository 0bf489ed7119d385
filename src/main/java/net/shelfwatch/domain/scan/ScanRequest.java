package net.shelfwatch.domain.scan;

import java.util.UUID;

public record ScanRequest(UUID pageId, String url, ScanDepth depth) {
}
