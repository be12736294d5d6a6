package com.bit.vote.structure.dto;

import com.bit.vote.structure.project.Project;
import com.bit.vote.structure.project.ProjectStatus;
import lombok.Data;

@Data
public class ProjectDTO {
    private long id;
    private String name;
    private String description;
    private long startTime;
    private long endTime;
    private long totalVotes;
    private boolean active;
    private boolean finalized;
    private String winner;
    private int voterCount;
    private ProjectStatus status;

    public static ProjectDTO from(Project project, long now) {
        ProjectDTO dto = new ProjectDTO();
        dto.setId(project.getId());
        dto.setName(project.getName());
        dto.setDescription(project.getDescription());
        dto.setStartTime(project.getStartTime());
        dto.setEndTime(project.getEndTime());
        dto.setTotalVotes(project.getTotalVotes());
        dto.setActive(project.isActive());
        dto.setFinalized(project.isFinalized());
        dto.setWinner(project.getWinner() == null ? null : project.getWinner().toBase58());
        dto.setVoterCount(project.getVoterCount());
        dto.setStatus(project.status(now));
        return dto;
    }
}
