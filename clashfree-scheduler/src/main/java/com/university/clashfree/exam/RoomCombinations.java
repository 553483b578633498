package com.university.clashfree.exam;

import com.university.clashfree.domain.Room;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Minimal sets of rooms whose combined supply covers an exam's demand:
 * single rooms first, then pairs where neither room suffices alone, then
 * triples where no pair suffices. Within one size, the smallest surplus
 * comes first.
 */
final class RoomCombinations {

    private RoomCombinations() {
    }

    static List<List<Room>> minimal(List<Room> rooms, ToIntFunction<Room> supply, int demand,
            int maxRooms, int limit) {
        List<Room> sorted = new ArrayList<>(rooms);
        sorted.sort(Comparator.comparing(Room::getId));
        List<List<Room>> result = new ArrayList<>();

        List<List<Room>> singles = new ArrayList<>();
        for (Room r : sorted) {
            if (supply.applyAsInt(r) >= demand) {
                singles.add(List.of(r));
            }
        }
        addBySurplus(result, singles, supply, demand, limit);
        if (maxRooms < 2 || result.size() >= limit) {
            return result;
        }

        List<List<Room>> pairs = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            Room a = sorted.get(i);
            int capA = supply.applyAsInt(a);
            if (capA >= demand) {
                continue;
            }
            for (int j = i + 1; j < sorted.size(); j++) {
                Room b = sorted.get(j);
                int capB = supply.applyAsInt(b);
                if (capB < demand && capA + capB >= demand) {
                    pairs.add(List.of(a, b));
                }
            }
        }
        addBySurplus(result, pairs, supply, demand, limit);
        if (maxRooms < 3 || result.size() >= limit) {
            return result;
        }

        List<List<Room>> triples = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            Room a = sorted.get(i);
            for (int j = i + 1; j < sorted.size(); j++) {
                Room b = sorted.get(j);
                int capAB = supply.applyAsInt(a) + supply.applyAsInt(b);
                if (capAB >= demand) {
                    continue;
                }
                for (int k = j + 1; k < sorted.size(); k++) {
                    Room c = sorted.get(k);
                    int capC = supply.applyAsInt(c);
                    if (capAB + capC >= demand
                            && supply.applyAsInt(a) + capC < demand
                            && supply.applyAsInt(b) + capC < demand) {
                        triples.add(List.of(a, b, c));
                    }
                }
            }
        }
        addBySurplus(result, triples, supply, demand, limit);
        return result;
    }

    static int total(List<Room> rooms, ToIntFunction<Room> supply) {
        int sum = 0;
        for (Room r : rooms) {
            sum += supply.applyAsInt(r);
        }
        return sum;
    }

    private static void addBySurplus(List<List<Room>> result, List<List<Room>> combos,
            ToIntFunction<Room> supply, int demand, int limit) {
        combos.sort(Comparator.comparingInt((List<Room> c) -> total(c, supply) - demand));
        for (List<Room> combo : combos) {
            if (result.size() >= limit) {
                return;
            }
            result.add(combo);
        }
    }
}
