package com.reviewmate.backend.modules.pullrequest.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.random.RandomGenerator;

import com.reviewmate.backend.modules.user.domain.ReviewUser;

/**
 * Stateless reviewer selection.
 * <p>
 * A user is eligible when active and not excluded. Eligible users are put in id order before any
 * random draw, so the outcome depends only on the pool's content and the generator, never on the
 * order in which the pool was loaded.
 */
public final class ReviewerSelector {

    private ReviewerSelector() {
    }

    /**
     * Active, non-excluded users of the pool, de-duplicated by id and sorted by id.
     */
    public static List<ReviewUser> eligible(Collection<ReviewUser> pool, Set<String> excludedIds) {
        Map<String, ReviewUser> byId = new LinkedHashMap<>();
        for (ReviewUser user : pool) {
            if (user.isActive() && !excludedIds.contains(user.getId())) {
                byId.putIfAbsent(user.getId(), user);
            }
        }
        List<ReviewUser> candidates = new ArrayList<>(byId.values());
        candidates.sort(Comparator.comparing(ReviewUser::getId));
        return candidates;
    }

    /**
     * Picks up to {@code desiredCount} distinct eligible users. When the eligible pool is no larger
     * than {@code desiredCount} all of it is returned; otherwise each subset of that size is equally
     * likely (partial Fisher-Yates shuffle).
     */
    public static List<ReviewUser> select(
            Collection<ReviewUser> pool,
            Set<String> excludedIds,
            int desiredCount,
            RandomGenerator random
    ) {
        if (desiredCount < 0) {
            throw new IllegalArgumentException("desiredCount must be >= 0");
        }
        Objects.requireNonNull(random, "random");
        List<ReviewUser> candidates = eligible(pool, excludedIds);
        if (candidates.size() <= desiredCount) {
            return List.copyOf(candidates);
        }
        int size = candidates.size();
        for (int i = 0; i < desiredCount; i++) {
            int j = i + random.nextInt(size - i);
            ReviewUser swap = candidates.get(i);
            candidates.set(i, candidates.get(j));
            candidates.set(j, swap);
        }
        return List.copyOf(candidates.subList(0, desiredCount));
    }

    /**
     * One uniformly random user out of an already filtered, non-empty candidate list.
     */
    public static ReviewUser pickOne(List<ReviewUser> candidates, RandomGenerator random) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("candidates must not be empty");
        }
        return candidates.get(random.nextInt(candidates.size()));
    }
}
