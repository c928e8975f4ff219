package com.project.lockup.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.project.lockup.core.LockupRecord;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Writer for lockup status reports to JSON files, one file per lockup address.
 * Amounts are written as decimal strings in base units so uint256 values survive any JSON reader.
 */
public class LockupReportWriter {

    private final Path outputDirectory;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public LockupReportWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public Path write(LockupStatusReport report) throws IOException {
        Files.createDirectories(outputDirectory);

        Path target = outputDirectory.resolve(buildFileName(report));
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), toJson(report));
        return target;
    }

    /**
     * Read back the stored record of a previously written report.
     *
     * @throws IOException if the file is not JSON or does not carry a well-formed lockup section
     */
    public LockupRecord readRecord(Path file) throws IOException {
        JsonNode lockup = MAPPER.readTree(file.toFile()).path("lockup");
        if (!lockup.isObject()) {
            throw new IOException("Not a lockup report: " + file);
        }
        if (!lockup.path("exists").asBoolean()) {
            return LockupRecord.EMPTY;
        }
        try {
            return new LockupRecord(
                    requireText(lockup, "beneficiary", file),
                    new BigInteger(requireText(lockup, "totalAmount", file)),
                    new BigInteger(requireText(lockup, "releasedAmount", file)),
                    requireLong(lockup, "startTime", file),
                    requireLong(lockup, "cliffDuration", file),
                    requireLong(lockup, "vestingDuration", file),
                    lockup.path("revocable").asBoolean(),
                    lockup.path("revoked").asBoolean(),
                    new BigInteger(requireText(lockup, "vestedAtRevoke", file))
            );
        } catch (NumberFormatException e) {
            throw new IOException("Not a lockup report: " + file + " (" + e.getMessage() + ")", e);
        }
    }

    private static String requireText(JsonNode node, String field, Path file) throws IOException {
        JsonNode value = node.path(field);
        if (!value.isTextual()) {
            throw new IOException("Not a lockup report: " + file + " (missing " + field + ")");
        }
        return value.asText();
    }

    private static long requireLong(JsonNode node, String field, Path file) throws IOException {
        JsonNode value = node.path(field);
        if (!value.canConvertToLong()) {
            throw new IOException("Not a lockup report: " + file + " (missing " + field + ")");
        }
        return value.asLong();
    }

    private String buildFileName(LockupStatusReport report) {
        return "lockup_" + sanitize(report.contractAddress()) + ".json";
    }

    private String sanitize(String input) {
        return input.replaceAll("[^a-zA-Z0-9-_]", "_");
    }

    private ObjectNode toJson(LockupStatusReport report) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("contractAddress", report.contractAddress());
        root.put("token", report.token());
        root.put("owner", report.owner());

        LockupRecord record = report.lockup();
        ObjectNode lockup = root.putObject("lockup");
        lockup.put("exists", record.exists());
        lockup.put("beneficiary", record.beneficiary());
        lockup.put("totalAmount", record.totalAmount().toString());
        lockup.put("releasedAmount", record.releasedAmount().toString());
        lockup.put("startTime", record.startTime());
        lockup.put("cliffDuration", record.cliffDuration());
        lockup.put("vestingDuration", record.vestingDuration());
        lockup.put("revocable", record.revocable());
        lockup.put("revoked", record.revoked());
        lockup.put("vestedAtRevoke", record.vestedAtRevoke().toString());

        root.put("vestedAmount", report.vestedAmount().toString());
        root.put("releasableAmount", report.releasableAmount().toString());
        root.put("vestingProgress", report.vestingProgress());
        root.put("remainingVestingTime", report.remainingVestingTime());
        root.put("phase", report.phase().name());
        root.put("observedAt", report.observedAt());
        root.put("exportedAt", Instant.now().toString());
        return root;
    }
}
