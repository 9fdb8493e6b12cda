package com.jreinhal.norma.foundation;

public record CostSnapshot(int calls, long tokensIn, long tokensOut, double costUsd) {
    public static final CostSnapshot EMPTY = new CostSnapshot(0, 0L, 0L, 0.0);

    public static CostSnapshot of(ModelReply reply) {
        return new CostSnapshot(1, reply.tokensIn(), reply.tokensOut(), reply.costUsd());
    }

    public CostSnapshot plus(CostSnapshot other) {
        return new CostSnapshot(this.calls + other.calls, this.tokensIn + other.tokensIn,
                this.tokensOut + other.tokensOut, this.costUsd + other.costUsd);
    }
}
