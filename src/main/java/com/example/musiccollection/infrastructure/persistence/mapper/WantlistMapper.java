package com.example.musiccollection.infrastructure.persistence.mapper;

import com.example.musiccollection.infrastructure.persistence.entity.WantlistEntity;
import java.math.BigDecimal;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface WantlistMapper {

    @Update("TRUNCATE TABLE discogs_wantlist")
    void truncate();

    @Insert("<script>"
            + "INSERT INTO discogs_wantlist(release_id, artist, album_title, label, format, `year`, date_added, notes, "
            + "num_for_sale, lowest_price, available, marketplace_url, thumb_url, cover_image_url) VALUES "
            + "<foreach item='w' collection='list' separator=','>"
            + "(#{w.releaseId}, #{w.artist}, #{w.albumTitle}, #{w.label}, #{w.format}, #{w.year}, #{w.dateAdded}, #{w.notes}, "
            + "#{w.numForSale}, #{w.lowestPrice}, #{w.available}, #{w.marketplaceUrl}, #{w.thumbUrl}, #{w.coverImageUrl})"
            + "</foreach>"
            + " ON DUPLICATE KEY UPDATE "
            + "num_for_sale = VALUES(num_for_sale), "
            + "lowest_price = VALUES(lowest_price), "
            + "available = VALUES(available), "
            + "updated_at = NOW()"
            + "</script>")
    int batchInsert(@Param("list") List<WantlistEntity> list);

    @Select("<script>"
            + "SELECT id, release_id, artist, album_title, label, format, `year`, date_added, notes, num_for_sale, "
            + "lowest_price, available, marketplace_url, thumb_url, cover_image_url, updated_at "
            + "FROM discogs_wantlist WHERE 1 = 1 "
            + "<if test='availableOnly'> AND available = TRUE</if>"
            + " ORDER BY artist, album_title LIMIT #{offset}, #{pageSize}"
            + "</script>")
    List<WantlistEntity> selectPage(@Param("offset") int offset,
                                    @Param("pageSize") int pageSize,
                                    @Param("availableOnly") boolean availableOnly);

    @Select("<script>"
            + "SELECT COUNT(1) FROM discogs_wantlist WHERE 1 = 1 "
            + "<if test='availableOnly'> AND available = TRUE</if>"
            + "</script>")
    long count(@Param("availableOnly") boolean availableOnly);

    @Select("SELECT SUM(lowest_price) FROM discogs_wantlist WHERE lowest_price IS NOT NULL")
    BigDecimal sumLowestPrice();
}
