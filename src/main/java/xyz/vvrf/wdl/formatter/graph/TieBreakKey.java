package xyz.vvrf.wdl.formatter.graph;

import xyz.vvrf.wdl.formatter.core.NodeKind;

import java.util.Comparator;
import java.util.Objects;

/**
 * 拓扑排序的确定性排序键 {@code (kindRank, insertionIndex)}。
 * HEAD 的键排在所有真实节点之前；尚未获得完整定义的占位节点排在最后。
 *
 * @author ruifeng.wen
 */
public final class TieBreakKey implements Comparable<TieBreakKey> {

    static final int HEAD_RANK = -1;
    static final int PLACEHOLDER_RANK = Integer.MAX_VALUE;

    static final TieBreakKey HEAD = new TieBreakKey(HEAD_RANK, 0);

    private static final Comparator<TieBreakKey> ORDER = Comparator
            .comparingInt(TieBreakKey::getKindRank)
            .thenComparingInt(TieBreakKey::getInsertionIndex);

    private final int kindRank;
    private final int insertionIndex;

    TieBreakKey(int kindRank, int insertionIndex) {
        this.kindRank = kindRank;
        this.insertionIndex = insertionIndex;
    }

    static TieBreakKey of(NodeKind kind, int insertionIndex) {
        return new TieBreakKey(kind.getRank(), insertionIndex);
    }

    static TieBreakKey placeholder(int insertionIndex) {
        return new TieBreakKey(PLACEHOLDER_RANK, insertionIndex);
    }

    public int getKindRank() {
        return kindRank;
    }

    public int getInsertionIndex() {
        return insertionIndex;
    }

    @Override
    public int compareTo(TieBreakKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TieBreakKey that = (TieBreakKey) o;
        return kindRank == that.kindRank && insertionIndex == that.insertionIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kindRank, insertionIndex);
    }

    @Override
    public String toString() {
        return "(" + kindRank + ", " + insertionIndex + ")";
    }
}
