package com.codecrucible.core.version;

import java.time.Instant;

/**
 * One stored snapshot of a run's code.
 */
public final class CodeVersion {

    private final String  entryId;
    private final int     iteration;
    private final String  code;
    private final String  message;
    private final int     qualityScore;
    private final int     cyclomaticComplexity;
    private final Instant createdAt;
    private final long    sequence;

    public CodeVersion(String entryId, int iteration, String code, String message,
                       int qualityScore, int cyclomaticComplexity, Instant createdAt, long sequence) {
        this.entryId              = entryId;
        this.iteration            = iteration;
        this.code                 = code;
        this.message              = message;
        this.qualityScore         = qualityScore;
        this.cyclomaticComplexity = cyclomaticComplexity;
        this.createdAt            = createdAt;
        this.sequence             = sequence;
    }

    public String  getEntryId()              { return entryId; }
    public int     getIteration()            { return iteration; }
    public String  getCode()                 { return code; }
    public String  getMessage()              { return message; }
    public int     getQualityScore()         { return qualityScore; }
    public int     getCyclomaticComplexity() { return cyclomaticComplexity; }
    public Instant getCreatedAt()            { return createdAt; }
    public long    getSequence()             { return sequence; }

    @Override
    public String toString() {
        return "CodeVersion{entry=" + entryId + ", iteration=" + iteration + ", seq=" + sequence
                + ", quality=" + qualityScore + ", complexity=" + cyclomaticComplexity + ", message=" + message + "}";
    }
}
