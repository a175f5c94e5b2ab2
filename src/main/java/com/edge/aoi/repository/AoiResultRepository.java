package com.edge.aoi.repository;

import com.edge.aoi.config.YamlConfig;
import com.edge.aoi.model.Board;
import com.edge.aoi.model.Panel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * SMT_AOI_RESULTS 表访问
 * <p>
 * 每块板一行，主键 (Serial_NMBR, Date_Time)，表上开启 IGNORE_DUP_KEY，重复上传会被忽略。
 */
@Repository
public class AoiResultRepository {
    private static final Logger logger = LoggerFactory.getLogger(AoiResultRepository.class);

    private static final String COLUMNS =
            "([Serial_NMBR], [Board_NMBR], [Program], [Station], [Operator], [Result], [Date_Time], [Failed], [Pseudo_error])";

    private final JdbcTemplate jdbcTemplate;
    private final String insertSql;

    public AoiResultRepository(JdbcTemplate jdbcTemplate, YamlConfig config) {
        this.jdbcTemplate = jdbcTemplate;
        this.insertSql = "INSERT INTO " + config.getUpload().getTable() + " " + COLUMNS
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
    }

    /**
     * 检查数据库连接
     */
    public boolean isAvailable() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            logger.warn("Database check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * 写入一批面板（同一事务）
     *
     * @return 写入的行数
     */
    @Transactional
    public int insert(List<Panel> panels) {
        List<Object[]> rows = new ArrayList<>();
        for (Panel panel : panels) {
            for (Board board : panel.getBoards()) {
                rows.add(toRow(panel, board));
            }
        }
        if (rows.isEmpty()) {
            return 0;
        }

        logger.debug("Upload: {} rows into {}", rows.size(), insertSql);
        int[] counts = jdbcTemplate.batchUpdate(insertSql, rows);

        int total = 0;
        for (int count : counts) {
            // 驱动可能不返回具体行数
            total += count == Statement.SUCCESS_NO_INFO ? 1 : count;
        }
        return total;
    }

    static Object[] toRow(Panel panel, Board board) {
        return new Object[]{
                board.getSerial(),
                board.getPosition(),
                panel.getProgram(),
                panel.getStation(),
                panel.getOperator(),
                board.getResult(),
                Timestamp.valueOf(panel.getRecordTime()),
                String.join(", ", board.getFailures()),
                String.join(", ", board.getPseudoFailures())
        };
    }

    String getInsertSql() {
        return insertSql;
    }
}
