package com.bit.vote.api;

import com.bit.vote.event.EventService;
import com.bit.vote.event.VotingEvent;
import com.bit.vote.result.Result;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/event")
public class EventApi {

    @Autowired
    private EventService eventService;

    /**
     * 供链下索引分页拉取事件
     */
    @GetMapping("/list")
    public Result<List<VotingEvent>> list(@RequestParam(value = "from", defaultValue = "1") long from,
                                          @RequestParam(value = "limit", defaultValue = "100") int limit) {
        if (limit <= 0 || limit > 1000) {
            return Result.error(400, "limit 必须在 1-1000 之间");
        }
        return Result.OK(eventService.list(from, limit));
    }
}
