package org.fsmsim.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 代表 DFA 的输入字母表。
 * 字母表不单独声明，而是由迁移声明中实际出现的字符推导得到。
 * 字符以 Unicode 码点保存，一个符号可以位于基本多文种平面之外。
 * Alphabet 是不可变对象，码点按升序排列，迭代顺序固定。
 */
public final class Alphabet {

    private static final Logger logger = LoggerFactory.getLogger(Alphabet.class);

    @Getter
    private final SortedSet<Integer> symbols;
    private final int hashCode;

    private Alphabet(Collection<Integer> symbols) {
        Objects.requireNonNull(symbols, "Symbols cannot be null");
        this.symbols = Collections.unmodifiableSortedSet(new TreeSet<>(symbols));
        this.hashCode = Objects.hash(this.symbols);
        logger.debug("创建 Alphabet，包含 {} 个字符。详情：{}", this.symbols.size(), this);
    }

    /**
     * 工厂方法：从码点集合创建 Alphabet，重复的码点只保留一个。
     * @param symbols 构成字母表的码点。
     * @return Alphabet 实例。
     */
    public static Alphabet of(Collection<Integer> symbols) {
        return new Alphabet(symbols);
    }

    /**
     * 工厂方法：从字符串中的每个码点创建 Alphabet。
     */
    public static Alphabet of(String symbols) {
        return new Alphabet(symbols.codePoints()
                .boxed()
                .collect(Collectors.toList()));
    }

    public boolean contains(int symbol) {
        return symbols.contains(symbol);
    }

    /**
     * 码点的字符串形式，用于错误信息和 toString。
     */
    public static String render(int symbol) {
        return new String(Character.toChars(symbol));
    }

    public int size() {
        return symbols.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Alphabet alphabet = (Alphabet) o;
        return symbols.equals(alphabet.symbols);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Alphabet{" +
                symbols.stream()
                        .map(Alphabet::render)
                        .collect(Collectors.joining(", ")) +
                '}';
    }
}
