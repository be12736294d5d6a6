package com.bit.vote.api;

import com.bit.vote.aop.annotation.PermissionsAnnotation;
import com.bit.vote.common.Address;
import com.bit.vote.project.ProjectService;
import com.bit.vote.result.Result;
import com.bit.vote.staking.StakingService;
import com.bit.vote.structure.dto.CreateProjectReq;
import com.bit.vote.structure.dto.ProjectDTO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/project")
public class ProjectApi {

    @Autowired
    private ProjectService projectService;

    @Autowired
    private StakingService stakingService;

    @Autowired
    private Clock clock;

    // 创建项目 仅管理员
    @PermissionsAnnotation
    @PostMapping("/create")
    public Result<Long> create(@RequestBody CreateProjectReq req) {
        long id = projectService.createProject(Address.fromBase58(req.getCaller()),
                req.getName(), req.getDescription(), req.getStartTime(), req.getDuration());
        return Result.OK(id);
    }

    @GetMapping("/get")
    public Result<ProjectDTO> get(@RequestParam("id") long id) {
        return Result.OK(ProjectDTO.from(projectService.getProject(id), clock.instant().getEpochSecond()));
    }

    @GetMapping("/total")
    public Result<Long> total() {
        return Result.OK(projectService.getTotalProjects());
    }

    // 按首次投票顺序列出投票人
    @GetMapping("/voters")
    public Result<List<String>> voters(@RequestParam("id") long id) {
        projectService.getProject(id);
        return Result.OK(stakingService.getVoters(id).stream()
                .map(Address::toBase58)
                .collect(Collectors.toList()));
    }
}
