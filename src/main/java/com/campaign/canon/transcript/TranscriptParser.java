package com.campaign.canon.transcript;

import com.campaign.canon.core.model.Utterance;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw transcripts into utterances. Utterance ids are
 * {@code <sessionId>:<line number>}, stable across re-ingestion of the same bytes.
 */
public class TranscriptParser {

    private static final Pattern TXT_LINE = Pattern.compile("^(?<speaker>.+?)\\s+(?<ts>\\d{2}:\\d{2}:\\d{2})\\s+(?<text>.+)$");
    private static final Pattern TIMECODE = Pattern.compile("^(\\d+):(\\d+):(\\d+)$");

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @throws IllegalArgumentException on a malformed line
     */
    public List<Utterance> parse(RawTranscript transcript, String sessionId) {
        return switch (transcript.getFormat()) {
            case JSONL -> parseJsonl(transcript.text(), sessionId);
            case TXT -> parseTxt(transcript.text(), sessionId);
        };
    }

    List<Utterance> parseJsonl(String content, String sessionId) {
        List<Utterance> utterances = new ArrayList<>();
        for (String line : content.split("\\R")) {
            line = line.strip();
            if (line.isEmpty()) {
                continue;
            }
            JsonNode node;
            try {
                node = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Invalid JSONL transcript line: " + line, e);
            }
            JsonNode start = node.get("start");
            JsonNode end = node.get("end");
            if (start == null || start.isNull() || end == null || end.isNull()) {
                throw new IllegalArgumentException("Missing start/end in JSONL line: " + line);
            }
            String speaker = node.hasNonNull("speaker") ? node.get("speaker").asText() : null;
            String text = node.hasNonNull("text") ? node.get("text").asText().strip() : "";
            utterances.add(new Utterance(sessionId + ":" + (utterances.size() + 1), sessionId, speaker,
                    toMillis(start.asDouble()), toMillis(end.asDouble()), text));
        }
        return utterances;
    }

    List<Utterance> parseTxt(String content, String sessionId) {
        List<String[]> rows = new ArrayList<>();
        List<Long> starts = new ArrayList<>();
        for (String line : content.split("\\R")) {
            line = line.strip();
            if (line.isEmpty()) {
                continue;
            }
            Matcher m = TXT_LINE.matcher(line);
            if (!m.matches()) {
                throw new IllegalArgumentException("Invalid TXT transcript line: " + line);
            }
            rows.add(new String[]{m.group("speaker").strip(), m.group("text").strip()});
            starts.add(parseTimecode(m.group("ts")));
        }
        List<Utterance> utterances = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            long start = starts.get(i);
            // Lines carry no end time: an utterance lasts until the next one starts.
            long end = i + 1 < rows.size() ? Math.max(start, starts.get(i + 1)) : start;
            utterances.add(new Utterance(sessionId + ":" + (i + 1), sessionId, rows.get(i)[0],
                    start, end, rows.get(i)[1]));
        }
        return utterances;
    }

    private static long toMillis(double seconds) {
        return Math.round(seconds * 1000);
    }

    private static long parseTimecode(String token) {
        Matcher m = TIMECODE.matcher(token.strip());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid timestamp: " + token);
        }
        long hours = Long.parseLong(m.group(1));
        long minutes = Long.parseLong(m.group(2));
        long seconds = Long.parseLong(m.group(3));
        return ((hours * 60 + minutes) * 60 + seconds) * 1000;
    }
}
