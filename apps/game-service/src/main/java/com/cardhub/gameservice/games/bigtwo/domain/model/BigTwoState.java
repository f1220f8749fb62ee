package com.cardhub.gameservice.games.bigtwo.domain.model;

import com.cardhub.gameservice.games.bigtwo.domain.enums.GamePhase;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 房间对局状态（单一事实来源）。
 * - 四家手牌 hands、本局已出牌堆 playedPile；
 * - 回合信息：currentTurn / lastPlay / consecutivePasses / matchNumber / phase；
 * - 自动过牌计时器 timer 与房间级计时器序号 lastTimerSequence（跨局不清零）；
 * - 累计分数 totals、最近一局结算 lastMatch、整场赢家 finalWinner；
 * - version：每次提交的状态迁移 +1，用于 CAS 持久化与快照排序。
 * 设计说明
 * - 本类不做规则校验，只承载状态；规则在 rule 包，迁移在 TurnStateMachine。
 * - 服务层采用写时复制：copy() 出一份，改完后整体替换。
 */
@Data
public class BigTwoState {

    public static final int SEATS = 4;
    public static final int HAND_SIZE = 13;

    private String roomId;

    /** 四家手牌，各自按 (rank, suit) 升序 */
    private List<List<Card>> hands = emptyHands();

    /** 本局已出的所有牌 */
    private List<Card> playedPile = new ArrayList<>();

    private int currentTurn;

    /** 上一手（无则为 null，表示当前座位领出） */
    private PlayRecord lastPlay;

    /** 连续过牌数，取值 0..2 */
    private int consecutivePasses;

    private int matchNumber = 1;

    private GamePhase phase = GamePhase.FIRST_PLAY;

    private TimerState timer = TimerState.NONE;

    /** 最近一次创建的计时器序号 */
    private long lastTimerSequence;

    private List<Integer> totals = new ArrayList<>(List.of(0, 0, 0, 0));

    private MatchResult lastMatch;

    /** 整场结束时的赢家（累计分最低） */
    private Integer finalWinner;

    /** 由机器人代打的座位 */
    private Set<Integer> botSeats = new LinkedHashSet<>();

    private long version;

    public List<Card> hand(int seat) {
        return hands.get(seat);
    }

    public List<Integer> handSizes() {
        List<Integer> sizes = new ArrayList<>(SEATS);
        for (List<Card> h : hands) sizes.add(h.size());
        return sizes;
    }

    public boolean inProgress() {
        return phase == GamePhase.FIRST_PLAY || phase == GamePhase.PLAYING;
    }

    /** 3♦ 的持有者；无人持有返回 -1 */
    public int holderOf(Card card) {
        for (int s = 0; s < SEATS; s++) {
            if (hands.get(s).contains(card)) return s;
        }
        return -1;
    }

    /** 深拷贝：手牌、牌堆、分数、机器人座位各自复制，不可变对象引用即可 */
    public BigTwoState copy() {
        BigTwoState s = new BigTwoState();
        s.roomId = this.roomId;
        List<List<Card>> hs = new ArrayList<>(SEATS);
        for (List<Card> h : this.hands) hs.add(new ArrayList<>(h));
        s.hands = hs;
        s.playedPile = new ArrayList<>(this.playedPile);
        s.currentTurn = this.currentTurn;
        s.lastPlay = this.lastPlay;
        s.consecutivePasses = this.consecutivePasses;
        s.matchNumber = this.matchNumber;
        s.phase = this.phase;
        s.timer = this.timer;
        s.lastTimerSequence = this.lastTimerSequence;
        s.totals = new ArrayList<>(this.totals);
        s.lastMatch = this.lastMatch;
        s.finalWinner = this.finalWinner;
        s.botSeats = new LinkedHashSet<>(this.botSeats);
        s.version = this.version;
        return s;
    }

    private static List<List<Card>> emptyHands() {
        List<List<Card>> hs = new ArrayList<>(SEATS);
        for (int i = 0; i < SEATS; i++) hs.add(new ArrayList<>());
        return hs;
    }
}
