package com.phonetic.matching.encoder;

import java.util.List;

/**
 * Caverphone 2.0, ten-character codes.
 */
public class Caverphone2 extends AbstractCaverphone {

    private static final List<Rewrite> REWRITES = List.of(
            rewrite("e$", ""),
            rewrite("^cough", "cou2f"),
            rewrite("^rough", "rou2f"),
            rewrite("^tough", "tou2f"),
            rewrite("^enough", "enou2f"),
            rewrite("^trough", "trou2f"),
            rewrite("^gn", "2n"),
            rewrite("mb$", "m2"),
            rewrite("cq", "2q"),
            rewrite("ci", "si"),
            rewrite("ce", "se"),
            rewrite("cy", "sy"),
            rewrite("tch", "2ch"),
            rewrite("c", "k"),
            rewrite("q", "k"),
            rewrite("x", "k"),
            rewrite("v", "f"),
            rewrite("dg", "2g"),
            rewrite("tio", "sio"),
            rewrite("tia", "sia"),
            rewrite("d", "t"),
            rewrite("ph", "fh"),
            rewrite("b", "p"),
            rewrite("sh", "s2"),
            rewrite("z", "s"),
            rewrite("^[aeiou]", "A"),
            rewrite("[aeiou]", "3"),
            rewrite("j", "y"),
            rewrite("^y3", "Y3"),
            rewrite("^y", "A"),
            rewrite("y", "3"),
            rewrite("3gh3", "3kh3"),
            rewrite("gh", "22"),
            rewrite("g", "k"),
            rewrite("s+", "S"),
            rewrite("t+", "T"),
            rewrite("p+", "P"),
            rewrite("k+", "K"),
            rewrite("f+", "F"),
            rewrite("m+", "M"),
            rewrite("n+", "N"),
            rewrite("w3", "W3"),
            rewrite("wh3", "Wh3"),
            rewrite("w$", "3"),
            rewrite("w", "2"),
            rewrite("^h", "A"),
            rewrite("h", "2"),
            rewrite("r3", "R3"),
            rewrite("r$", "3"),
            rewrite("r", "2"),
            rewrite("l3", "L3"),
            rewrite("l$", "3"),
            rewrite("l", "2"),
            rewrite("2", ""),
            rewrite("3$", "A"),
            rewrite("3", ""));

    public Caverphone2() {
        super(REWRITES, 10);
    }

    @Override
    public String getName() {
        return "caverphone2";
    }
}
