package com.bit.vote.structure.project;

import com.bit.vote.common.Address;
import lombok.Data;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * 投票项目：固定时间窗口内接受质押投票，结算后产生唯一获胜者
 */
@Data
public class Project {

    /**
     * 项目ID 创建时顺序分配 从不复用
     */
    private long id;

    private String name;

    private String description;

    /**
     * 投票开始时间（epoch秒，含）
     */
    private long startTime;

    /**
     * 投票结束时间（epoch秒，含） = startTime + duration
     */
    private long endTime;

    /**
     * 投票总额 只增不减
     */
    private long totalVotes;

    /**
     * 创建时为true 结算时置为false
     */
    private boolean active;

    /**
     * 结算标志 一旦为true不再回退
     */
    private boolean finalized;

    /**
     * 获胜者 结算前为null
     */
    private Address winner;

    /**
     * 投票人数量 即投票人序列的长度
     */
    private int voterCount;

    public Project copy() {
        return deserialize(serialize());
    }

    public ProjectStatus status(long now) {
        return ProjectStatus.resolve(this, now);
    }

    // 布局：id|start|end|totalVotes|flags|voterCount|winner?|name|description
    public byte[] serialize() {
        byte[] nameBytes = name == null ? new byte[0] : name.getBytes(StandardCharsets.UTF_8);
        byte[] descBytes = description == null ? new byte[0] : description.getBytes(StandardCharsets.UTF_8);
        int size = 8 * 4 + 1 + 4 + (winner == null ? 0 : Address.LENGTH) + 4 + nameBytes.length + 4 + descBytes.length;
        ByteBuffer buffer = ByteBuffer.allocate(size);
        buffer.putLong(id);
        buffer.putLong(startTime);
        buffer.putLong(endTime);
        buffer.putLong(totalVotes);
        byte flags = 0;
        if (active) flags |= 1;
        if (finalized) flags |= 1 << 1;
        if (winner != null) flags |= 1 << 2;
        buffer.put(flags);
        buffer.putInt(voterCount);
        if (winner != null) {
            buffer.put(winner.toBytes());
        }
        buffer.putInt(nameBytes.length);
        buffer.put(nameBytes);
        buffer.putInt(descBytes.length);
        buffer.put(descBytes);
        return buffer.array();
    }

    public static Project deserialize(byte[] data) {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        Project project = new Project();
        project.setId(buffer.getLong());
        project.setStartTime(buffer.getLong());
        project.setEndTime(buffer.getLong());
        project.setTotalVotes(buffer.getLong());
        byte flags = buffer.get();
        project.setActive((flags & 1) != 0);
        project.setFinalized((flags & (1 << 1)) != 0);
        project.setVoterCount(buffer.getInt());
        if ((flags & (1 << 2)) != 0) {
            byte[] winnerBytes = new byte[Address.LENGTH];
            buffer.get(winnerBytes);
            project.setWinner(Address.fromBytes(winnerBytes));
        }
        byte[] nameBytes = new byte[buffer.getInt()];
        buffer.get(nameBytes);
        project.setName(new String(nameBytes, StandardCharsets.UTF_8));
        byte[] descBytes = new byte[buffer.getInt()];
        buffer.get(descBytes);
        project.setDescription(new String(descBytes, StandardCharsets.UTF_8));
        return project;
    }
}
