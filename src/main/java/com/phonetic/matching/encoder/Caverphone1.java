package com.phonetic.matching.encoder;

import java.util.List;

/**
 * Caverphone 1.0, six-character codes.
 */
public class Caverphone1 extends AbstractCaverphone {

    private static final List<Rewrite> REWRITES = List.of(
            rewrite("^cough", "cou2f"),
            rewrite("^rough", "rou2f"),
            rewrite("^tough", "tou2f"),
            rewrite("^enough", "enou2f"),
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
            rewrite("wy", "Wy"),
            rewrite("wh3", "Wh3"),
            rewrite("why", "Why"),
            rewrite("w", "2"),
            rewrite("^h", "A"),
            rewrite("h", "2"),
            rewrite("r3", "R3"),
            rewrite("ry", "Ry"),
            rewrite("r", "2"),
            rewrite("l3", "L3"),
            rewrite("ly", "Ly"),
            rewrite("l", "2"),
            rewrite("j", "y"),
            rewrite("y3", "Y3"),
            rewrite("y", "2"),
            rewrite("2", ""),
            rewrite("3", ""));

    public Caverphone1() {
        super(REWRITES, 6);
    }

    @Override
    public String getName() {
        return "caverphone1";
    }
}
