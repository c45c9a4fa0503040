package com.fibrepay.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Aggregated approved pay and quantities for a set of tasks
 */
public record PayrollTotals(
        BigDecimal totalPay,
        BigDecimal combedKg,
        BigDecimal wovenM,
        int taskCount
) {

    public static final PayrollTotals EMPTY = new PayrollTotals(Money.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0);

    /**
     * Sum settled pay and per-category quantities. Task types missing from the
     * category map count towards pay only.
     */
    public static PayrollTotals of(List<WorkTask> tasks, Map<String, TaskCategory> categoryByTaskType) {
        BigDecimal pay = BigDecimal.ZERO;
        BigDecimal combed = BigDecimal.ZERO;
        BigDecimal woven = BigDecimal.ZERO;

        for (WorkTask task : tasks) {
            if (task.getApprovedPay() != null) {
                pay = pay.add(task.getApprovedPay());
            }
            BigDecimal quantity = task.getQuantity() != null ? task.getQuantity() : BigDecimal.ZERO;
            TaskCategory category = categoryByTaskType.getOrDefault(task.getTaskTypeId(), TaskCategory.OTHER);
            if (category == TaskCategory.COMBING) {
                combed = combed.add(quantity);
            } else if (category == TaskCategory.WEAVING) {
                woven = woven.add(quantity);
            }
        }

        return new PayrollTotals(Money.round(pay), combed, woven, tasks.size());
    }

    public boolean isPayable() {
        return totalPay.signum() > 0;
    }
}
