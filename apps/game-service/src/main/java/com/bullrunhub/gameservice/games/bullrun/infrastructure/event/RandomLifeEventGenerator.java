package com.bullrunhub.gameservice.games.bullrun.infrastructure.event;

import com.bullrunhub.gameservice.games.bullrun.domain.enums.LifeEventType;
import com.bullrunhub.gameservice.games.bullrun.domain.event.LifeEventGenerator;
import com.bullrunhub.gameservice.games.bullrun.domain.model.LifeEvent;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * 随机生活事件生成器。
 *
 * 规则：
 * - 从事件池中随机抽取，池子用完之前不重复；
 * - 随机分配 (year, month)，同一玩家不会有两个事件落在同一个月；
 * - 资产解锁的年份（解锁表的数字 key）第 1 个月不安排事件；
 * - 第 1 年第 1 个月是开局月，不会被推进到，也不安排。
 */
@Component
public class RandomLifeEventGenerator implements LifeEventGenerator {

    static final int TOTAL_GAME_YEARS = 20;

    record Template(String message, double amount) {
    }

    static final List<Template> LOSSES = List.of(
            new Template("House robbery during Diwali", -30000),
            new Template("Family medical emergency", -75000),
            new Template("Vehicle repair after monsoon", -20000),
            new Template("Wedding shopping expenses", -50000),
            new Template("Health insurance deductible", -25000),
            new Template("Home repairs after flooding", -45000),
            new Template("Laptop suddenly stopped working", -50000),
            new Template("Legal fees for property dispute", -40000),
            new Template("AC breakdown in peak summer", -10000),
            new Template("Parent hospitalization costs", -80000),
            new Template("Car accident - insurance excess", -22000),
            new Template("Stolen mobile phone", -12000),
            new Template("Urgent home appliance replacement", -28000),
            new Template("Child school fees increase", -50000),
            new Template("Unexpected tax liability", -30000),
            new Template("Emergency dental treatment", -18000),
            new Template("Bike accident repair", -14000),
            new Template("Flooding damaged furniture", -40000),
            new Template("Friend wedding gift expected", -10000),
            new Template("Pet medical emergency", -10000));

    static final List<Template> GAINS = List.of(
            new Template("Diwali bonus from company", 50000),
            new Template("Freelance project bonus", 40000),
            new Template("Side business profit", 35000),
            new Template("Performance bonus at work", 45000),
            new Template("Tax refund received", 25000),
            new Template("Sold old items online", 15000),
            new Template("Investment dividend received", 30000));

    private final Random random;

    public RandomLifeEventGenerator() {
        this(new SecureRandom());
    }

    RandomLifeEventGenerator(Random random) {
        this.random = random;
    }

    @Override
    public List<LifeEvent> generateLifeEvents(int count, JsonNode unlockSchedule) {
        if (count <= 0) {
            return new ArrayList<>();
        }
        List<int[]> slots = freeSlots(disallowedYears(unlockSchedule));
        Collections.shuffle(slots, random);

        List<Template> pool = new ArrayList<>(GAINS);
        pool.addAll(LOSSES);
        Collections.shuffle(pool, random);

        int n = Math.min(count, slots.size());
        List<LifeEvent> events = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            // 池子用完后才允许重复
            Template t = pool.get(i % pool.size());
            int[] slot = slots.get(i);
            events.add(new LifeEvent(
                    UUID.randomUUID().toString(),
                    t.amount() >= 0 ? LifeEventType.GAIN : LifeEventType.LOSS,
                    t.message(),
                    t.amount(),
                    slot[0],
                    slot[1],
                    false));
        }
        events.sort(Comparator.comparingInt(LifeEvent::getGameYear).thenComparingInt(LifeEvent::getGameMonth));
        return events;
    }

    private static Set<Integer> disallowedYears(JsonNode unlockSchedule) {
        Set<Integer> years = new HashSet<>();
        if (unlockSchedule == null || !unlockSchedule.isObject()) {
            return years;
        }
        Iterator<String> names = unlockSchedule.fieldNames();
        while (names.hasNext()) {
            String name = StringUtils.trim(names.next());
            // 只认数字 key（年份）
            if (StringUtils.isNumeric(name) && name.length() <= 4) {
                years.add(Integer.parseInt(name));
            }
        }
        return years;
    }

    private static List<int[]> freeSlots(Set<Integer> unlockYears) {
        List<int[]> slots = new ArrayList<>(TOTAL_GAME_YEARS * 12);
        for (int y = 1; y <= TOTAL_GAME_YEARS; y++) {
            for (int m = 1; m <= 12; m++) {
                if (m == 1 && (y == 1 || unlockYears.contains(y))) {
                    continue;
                }
                slots.add(new int[]{y, m});
            }
        }
        return slots;
    }
}
