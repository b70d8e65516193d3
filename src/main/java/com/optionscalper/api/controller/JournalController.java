package com.optionscalper.api.controller;

import com.optionscalper.journal.DailyPnlService;
import com.optionscalper.journal.TradeJournalService;
import com.optionscalper.journal.TradeRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Trade history and realized P&L by day.
 *
 * <ul>
 *   <li>GET /api/journal/trades[?date=yyyy-MM-dd] -- all trades (latest first) or one day's</li>
 *   <li>GET /api/journal/daily-pnl -- cumulative realized P&L per date, latest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/journal")
public class JournalController {

    private final TradeJournalService tradeJournalService;
    private final DailyPnlService dailyPnlService;

    public JournalController(TradeJournalService tradeJournalService, DailyPnlService dailyPnlService) {
        this.tradeJournalService = tradeJournalService;
        this.dailyPnlService = dailyPnlService;
    }

    @GetMapping("/trades")
    public ResponseEntity<List<TradeRecord>> getTrades(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        List<TradeRecord> trades =
                date != null ? tradeJournalService.getTradesFor(date) : tradeJournalService.getAllTrades();
        return ResponseEntity.ok(trades);
    }

    @GetMapping("/daily-pnl")
    public ResponseEntity<Map<LocalDate, BigDecimal>> getDailyPnl() {
        return ResponseEntity.ok(dailyPnlService.getAll());
    }
}
