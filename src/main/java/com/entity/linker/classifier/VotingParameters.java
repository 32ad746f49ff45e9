package com.entity.linker.classifier;

import java.util.List;

/**
 * Trained members of a voting classifier and the way their outputs are combined.
 */
public record VotingParameters(VotingMode mode, List<Member> members) implements ModelParameters {

    public VotingParameters {
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Voting needs at least one member");
        }
        members = List.copyOf(members);
        int size = members.get(0).parameters().inputSize();
        for (Member member : members) {
            if (member.parameters().inputSize() != size) {
                throw new IllegalArgumentException("Voting members expect different feature counts");
            }
            if (mode == VotingMode.SOFT && !member.algorithm().isCalibrated()) {
                throw new IllegalArgumentException("Soft voting needs calibrated members, "
                        + member.algorithm().id() + " emits margins");
            }
        }
    }

    @Override
    public int inputSize() {
        return members.get(0).parameters().inputSize();
    }

    @Override
    public double score(double[] input) {
        double total = 0.0;
        for (Member member : members) {
            double score = member.parameters().score(input);
            if (mode == VotingMode.SOFT) {
                total += Math.min(1.0, Math.max(0.0, score));
            } else if (score >= (member.algorithm().isCalibrated() ? 0.5 : 0.0)) {
                total += 1.0;
            }
        }
        return total / members.size();
    }

    /**
     * One trained member.
     */
    public record Member(ClassifierType algorithm, ModelParameters parameters) {

        public Member {
            if (algorithm == null || parameters == null) {
                throw new IllegalArgumentException("algorithm and parameters are required");
            }
            if (algorithm == ClassifierType.VOTING) {
                throw new IllegalArgumentException("A voting classifier cannot be its own member");
            }
        }
    }
}
