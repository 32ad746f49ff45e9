package com.entity.linker.classifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Trains every configured member on the same data and combines them by vote.
 *
 * <p>Soft voting averages the members' match probabilities. Hard voting scores the
 * fraction of members whose own label is a match, so a tie counts as a match.
 * Either way the score reads as a probability.</p>
 */
public class VotingClassifier extends AbstractClassifier {
    private static final Logger log = LoggerFactory.getLogger(VotingClassifier.class);

    public VotingClassifier(ClassifierOptions options) {
        super(options);
    }

    @Override
    public ClassifierType type() {
        return ClassifierType.VOTING;
    }

    @Override
    protected ModelParameters train(TrainingData data) {
        List<VotingParameters.Member> members = new ArrayList<>();
        for (ClassifierType algorithm : options.getVotingMembers()) {
            long start = System.nanoTime();
            ModelParameters parameters = Classifiers.base(algorithm, options).train(data);
            members.add(new VotingParameters.Member(algorithm, parameters));
            log.debug("voting.member.trained algorithm={} durationMs={}",
                    algorithm.id(), (System.nanoTime() - start) / 1_000_000);
        }
        return new VotingParameters(options.getVotingMode(), members);
    }
}
