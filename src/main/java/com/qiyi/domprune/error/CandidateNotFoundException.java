package com.qiyi.domprune.error;

/**
 * 候选 backend_node_id 在树中不存在（调用方契约违规）。
 */
public class CandidateNotFoundException extends DomPruneException {

    private final String candidateId;

    public CandidateNotFoundException(String candidateId) {
        super(ErrorKind.NOT_FOUND, "Candidate not found in tree | backend_node_id=" + candidateId);
        this.candidateId = candidateId;
    }

    public String getCandidateId() {
        return candidateId;
    }
}
