package com.grouptab.expense.settlement;

import com.grouptab.expense.balance.Obligation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Nets pairwise obligations into at most one transfer per pair of members.
 *
 * <p>Each unordered pair is keyed by its two member ids in lexicographic order (lo, hi). The net
 * for a pair is the sum of lo→hi amounts minus the sum of hi→lo amounts: a positive net means lo
 * pays hi, a negative net means hi pays lo. Nets under one cent are dropped, as are obligations a
 * member has towards themselves.</p>
 */
@Slf4j
@Component
public class DebtSimplifier {

    static final BigDecimal MIN_TRANSFER = new BigDecimal("0.01");

    private static final Comparator<Pair> PAIR_ORDER = Comparator.comparing(Pair::lo).thenComparing(Pair::hi);

    public List<SimplifiedDebt> simplify(Collection<Obligation> obligations) {
        Map<Pair, BigDecimal> nets = new TreeMap<>(PAIR_ORDER);

        for (Obligation obligation : obligations) {
            if (obligation.from().equals(obligation.to())) {
                continue;
            }
            boolean forward = obligation.from().compareTo(obligation.to()) < 0;
            Pair pair = forward
                    ? new Pair(obligation.from(), obligation.to())
                    : new Pair(obligation.to(), obligation.from());
            BigDecimal signed = forward ? obligation.amount() : obligation.amount().negate();
            nets.merge(pair, signed, BigDecimal::add);
        }

        List<SimplifiedDebt> transfers = new ArrayList<>();
        nets.forEach((pair, net) -> {
            if (net.abs().compareTo(MIN_TRANSFER) < 0) {
                return;
            }
            BigDecimal amount = net.abs().setScale(2, RoundingMode.HALF_UP);
            transfers.add(net.signum() > 0
                    ? new SimplifiedDebt(pair.lo(), pair.hi(), amount)
                    : new SimplifiedDebt(pair.hi(), pair.lo(), amount));
        });

        log.debug("Simplified {} obligations into {} transfers", obligations.size(), transfers.size());
        return transfers;
    }

    private record Pair(String lo, String hi) {
    }
}
